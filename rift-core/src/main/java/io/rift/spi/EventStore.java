package io.rift.spi;

import io.rift.EventMetadata;
import io.rift.EventType;
import io.rift.Source;
import io.rift.model.EventRow;
import io.rift.model.EventTotals;
import io.rift.model.NewEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistence contract for events and their audit trail.
 *
 * <p>Every method receives an explicit {@link Connection}; implementations never
 * open, commit or close connections themselves.
 */
public interface EventStore {

    /**
     * Inserts the event and its audit entry on {@code conn}.
     *
     * <p>Both rows become visible together or not at all; the caller's transaction
     * decides which. If another event with the same idempotency key already exists,
     * nothing is written and an empty result is returned.
     *
     * @return the assigned event id, or empty if the insert lost a duplicate race
     */
    Optional<String> insert(Connection conn, NewEvent event);

    /**
     * Returns {@code true} if an event with the same source, type and canonical
     * metadata was created at or after {@code since}.
     */
    boolean existsSince(Connection conn, Source source, EventType eventType,
                        EventMetadata metadata, Instant since);

    /**
     * Aggregates all stored events per event type in one read.
     *
     * @param dayStart inclusive start of the "today" window
     * @param dayEnd   exclusive end of the "today" window
     */
    List<EventTotals> aggregateByType(Connection conn, Instant dayStart, Instant dayEnd);

    /**
     * Streams events created at or after {@code since}, oldest first.
     */
    void forEachCreatedSince(Connection conn, Instant since, Consumer<EventRow> consumer);
}
