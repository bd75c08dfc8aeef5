package io.rift;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A validated activity event as submitted by a caller, before admission.
 *
 * <p>{@code reportedAt} is the sender's own timestamp. It is informational only:
 * the store assigns the authoritative creation time on admission.
 *
 * @param source     originating system
 * @param eventType  kind of activity
 * @param metadata   attached document, never null
 * @param reportedAt sender timestamp, may be null
 */
public record IncomingEvent(Source source, EventType eventType, EventMetadata metadata, Instant reportedAt) {
    public IncomingEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(eventType, "eventType");
        metadata = metadata != null ? metadata : EventMetadata.empty();
    }

    public static IncomingEvent of(Source source, EventType eventType) {
        return new IncomingEvent(source, eventType, EventMetadata.empty(), null);
    }

    /**
     * Validates raw wire values and builds an event.
     *
     * @throws InvalidEventException if the source or event type is unknown
     *     or the metadata is not acceptable
     */
    public static IncomingEvent fromWire(String source, String eventType,
                                         Map<String, ?> metadata, Instant reportedAt) {
        return new IncomingEvent(Source.fromWire(source), EventType.fromWire(eventType),
                EventMetadata.of(metadata), reportedAt);
    }
}
