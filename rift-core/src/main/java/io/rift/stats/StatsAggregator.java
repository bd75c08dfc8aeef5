package io.rift.stats;

import io.rift.EventStoreException;
import io.rift.EventType;
import io.rift.model.EventRow;
import io.rift.model.EventTotals;
import io.rift.spi.ConnectionProvider;
import io.rift.spi.EventStore;
import io.rift.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes {@link DerivedStats} and {@link DailyStats} from the event store.
 *
 * <p>Reads run on their own connection from the {@link ConnectionProvider},
 * outside any ingestion transaction. "Today" and daily buckets are calendar
 * days in the configured zone.
 */
public final class StatsAggregator {
    public static final int MAX_DAYS = 365;

    private final ConnectionProvider connectionProvider;
    private final EventStore eventStore;
    private final ZoneId zone;
    private final Clock clock;
    private final MetricsExporter metrics;

    public StatsAggregator(ConnectionProvider connectionProvider, EventStore eventStore) {
        this(connectionProvider, eventStore, ZoneId.of("UTC"), Clock.systemUTC(), MetricsExporter.NOOP);
    }

    public StatsAggregator(ConnectionProvider connectionProvider, EventStore eventStore,
                           ZoneId zone, Clock clock, MetricsExporter metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    /**
     * Aggregates every stored event in a single read.
     *
     * @throws EventStoreException if the read fails
     */
    public DerivedStats currentStats() {
        long started = System.nanoTime();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        Instant dayStart = today.atStartOfDay(zone).toInstant();
        Instant dayEnd = today.plusDays(1).atStartOfDay(zone).toInstant();

        List<EventTotals> totals;
        try (Connection conn = connectionProvider.getConnection()) {
            totals = eventStore.aggregateByType(conn, dayStart, dayEnd);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection for stats", e);
        }
        DerivedStats stats = derive(totals);
        metrics.recordStatsDurationMs((System.nanoTime() - started) / 1_000_000);
        return stats;
    }

    /**
     * Folds per-type totals into derived stats: sums, level progression and rank.
     */
    public static DerivedStats derive(List<EventTotals> totals) {
        long gold = 0;
        long xp = 0;
        long events = 0;
        long today = 0;
        long[] byType = new long[EventType.values().length];
        for (EventTotals t : totals) {
            gold += t.gold();
            xp += t.xp();
            events += t.events();
            today += t.eventsToday();
            byType[t.eventType().ordinal()] += t.events();
        }
        long meetings = byType[EventType.MEETING_BOOKED.ordinal()];
        LevelProgression level = LevelProgression.fromTotalXp(xp);
        return new DerivedStats(gold, xp, events, today,
                byType[EventType.CALL_DIAL.ordinal()],
                byType[EventType.CALL_CONNECT.ordinal()],
                meetings,
                level.level(), level.xpInLevel(), level.xpToNext(),
                Rank.forMeetings(meetings));
    }

    /**
     * Per-day totals for the last {@code days} calendar days including today,
     * newest first. Days without events are omitted.
     *
     * @throws IllegalArgumentException if {@code days} is outside {@code 1..365}
     * @throws EventStoreException if the read fails
     */
    public List<DailyStats> dailyStats(int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS);
        }
        LocalDate today = LocalDate.now(clock.withZone(zone));
        Instant since = today.minusDays(days - 1L).atStartOfDay(zone).toInstant();

        Map<LocalDate, long[]> buckets = new TreeMap<>(Comparator.reverseOrder());
        try (Connection conn = connectionProvider.getConnection()) {
            eventStore.forEachCreatedSince(conn, since, row -> accumulate(buckets, row));
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection for daily stats", e);
        }

        List<DailyStats> result = new ArrayList<>(buckets.size());
        buckets.forEach((date, c) -> result.add(new DailyStats(date, c[0], c[1], c[2], c[3], c[4], c[5])));
        return result;
    }

    private void accumulate(Map<LocalDate, long[]> buckets, EventRow row) {
        LocalDate day = LocalDate.ofInstant(row.createdAt(), zone);
        long[] c = buckets.computeIfAbsent(day, d -> new long[6]);
        c[0]++;
        c[1] += row.gold();
        c[2] += row.xp();
        switch (row.eventType()) {
            case CALL_DIAL -> c[3]++;
            case CALL_CONNECT -> c[4]++;
            case MEETING_BOOKED -> c[5]++;
            default -> {
            }
        }
    }
}
