/**
 * Derived statistics: totals, level progression and the rank ladder.
 */
package io.rift.stats;
