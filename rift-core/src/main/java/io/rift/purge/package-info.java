/**
 * Scheduled retention purge of old events.
 */
package io.rift.purge;
