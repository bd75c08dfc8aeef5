package io.rift.model;

import io.rift.EventType;
import io.rift.Source;

import java.time.Instant;

/**
 * Projection of a stored event used by day-bucketed reporting.
 *
 * @param id        store-assigned id
 * @param source    originating system
 * @param eventType kind of activity
 * @param gold      gold awarded
 * @param xp        XP awarded
 * @param createdAt store-assigned creation time
 */
public record EventRow(String id, Source source, EventType eventType, int gold, int xp, Instant createdAt) {
}
