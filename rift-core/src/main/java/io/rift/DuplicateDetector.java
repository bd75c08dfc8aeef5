package io.rift;

import io.rift.spi.EventStore;
import io.rift.util.Hashing;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether an incoming event repeats one admitted within a sliding window.
 *
 * <p>Two events match when source, event type and canonical metadata are equal.
 * The read check is backed by an idempotency key stored under a unique
 * constraint: {@code sha256(source|event_type|metadata) + ":" + bucket}, where
 * the bucket is {@code epochMillis / windowMillis}. Concurrent identical
 * requests that both pass the read check collapse on that key.
 */
public final class DuplicateDetector {
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    private final EventStore eventStore;
    private final Duration window;

    public DuplicateDetector(EventStore eventStore) {
        this(eventStore, DEFAULT_WINDOW);
    }

    public DuplicateDetector(EventStore eventStore, Duration window) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be > 0");
        }
        this.window = window;
    }

    public Duration window() {
        return window;
    }

    /**
     * Returns {@code true} if a matching event was created at or after {@code now - window}.
     * Read-only.
     */
    public boolean isDuplicate(Connection conn, IncomingEvent event, Instant now) {
        Objects.requireNonNull(event, "event");
        Instant since = now.minus(window);
        return eventStore.existsSince(conn, event.source(), event.eventType(), event.metadata(), since);
    }

    /**
     * Computes the idempotency key for {@code event} admitted at {@code now}.
     */
    public String idempotencyKey(IncomingEvent event, Instant now) {
        String identity = event.source().wireName() + "|"
                + event.eventType().wireName() + "|"
                + event.metadata().canonicalJson();
        long bucket = Math.floorDiv(now.toEpochMilli(), window.toMillis());
        return Hashing.sha256Hex(identity) + ":" + bucket;
    }
}
