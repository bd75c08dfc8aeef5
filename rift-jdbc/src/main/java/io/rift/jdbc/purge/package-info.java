/**
 * Retention purgers per database.
 */
package io.rift.jdbc.purge;
