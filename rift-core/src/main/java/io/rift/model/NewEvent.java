package io.rift.model;

import io.rift.EventMetadata;
import io.rift.EventType;
import io.rift.Reward;
import io.rift.Source;

import java.time.Instant;
import java.util.Objects;

/**
 * An event that passed validation, duplicate screening and rule lookup, ready
 * to be persisted. The store assigns the id and creation time.
 *
 * @param source         originating system
 * @param eventType      kind of activity
 * @param reward         reward resolved from the rule table at admission time
 * @param metadata       attached document
 * @param reportedAt     sender timestamp, may be null
 * @param idempotencyKey unique key guarding against concurrent duplicate admission
 */
public record NewEvent(
        Source source,
        EventType eventType,
        Reward reward,
        EventMetadata metadata,
        Instant reportedAt,
        String idempotencyKey) {

    public NewEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(reward, "reward");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
    }
}
