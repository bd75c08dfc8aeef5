package io.rift.server.api;

import io.rift.stats.DerivedStats;

/**
 * Wire form of {@link DerivedStats}; the rank travels as its display name.
 */
public record CurrentStatsResponse(
        long totalGold,
        long totalXp,
        long currentLevel,
        long xpInCurrentLevel,
        long xpToNextLevel,
        long eventsToday,
        long totalEvents,
        String rank,
        long callsMade,
        long callsConnected,
        long meetingsBooked) {

    public static CurrentStatsResponse from(DerivedStats stats) {
        return new CurrentStatsResponse(stats.totalGold(), stats.totalXp(), stats.currentLevel(),
                stats.xpInCurrentLevel(), stats.xpToNextLevel(), stats.eventsToday(), stats.totalEvents(),
                stats.rank().displayName(), stats.callsMade(), stats.callsConnected(), stats.meetingsBooked());
    }
}
