package io.rift.stats;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Totals for one calendar day.
 */
public record DailyStats(
        LocalDate date,
        long totalEvents,
        long totalGold,
        long totalXp,
        long callsMade,
        long callsConnected,
        long meetingsBooked) {

    public DailyStats {
        Objects.requireNonNull(date, "date");
    }
}
