package io.rift.stats;

import java.util.Objects;

/**
 * Aggregate view over every stored event. Computed on demand, never persisted,
 * and free of wall-clock fields so repeated reads compare equal.
 */
public record DerivedStats(
        long totalGold,
        long totalXp,
        long totalEvents,
        long eventsToday,
        long callsMade,
        long callsConnected,
        long meetingsBooked,
        long currentLevel,
        long xpInCurrentLevel,
        long xpToNextLevel,
        Rank rank) {

    public DerivedStats {
        Objects.requireNonNull(rank, "rank");
    }
}
