package io.rift.model;

import io.rift.EventType;

import java.util.Objects;

/**
 * Aggregated totals for one event type, as returned by the stats read path.
 *
 * @param eventType   the event type
 * @param events      number of stored events of this type
 * @param gold        sum of gold values
 * @param xp          sum of XP values
 * @param eventsToday number of those events created within the current day window
 */
public record EventTotals(EventType eventType, long events, long gold, long xp, long eventsToday) {
    public EventTotals {
        Objects.requireNonNull(eventType, "eventType");
    }
}
