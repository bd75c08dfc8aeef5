package io.rift.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes events past their retention period. Audit entries follow their event.
 */
public interface EventPurger {

    /**
     * Deletes up to {@code limit} events created before {@code before}, oldest first.
     *
     * @return number of events deleted
     */
    int purge(Connection conn, Instant before, int limit);

    /**
     * Counts events created before {@code before} without deleting them.
     */
    long countOlderThan(Connection conn, Instant before);
}
