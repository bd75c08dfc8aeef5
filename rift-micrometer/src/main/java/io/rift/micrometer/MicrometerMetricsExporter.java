package io.rift.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.rift.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code rift.ingest.admitted} - events persisted with a reward</li>
 *   <li>{@code rift.ingest.duplicate} - submissions collapsed as duplicates</li>
 *   <li>{@code rift.ingest.rejected} - submissions with no reward rule</li>
 *   <li>{@code rift.ingest.failed} - submissions whose write failed</li>
 *   <li>{@code rift.purge.deleted} - events removed by retention purge</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code rift.purge.last.deleted} - events removed by the latest purge cycle</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code rift.ingest.gold} - gold granted per admitted event</li>
 *   <li>{@code rift.ingest.xp} - XP granted per admitted event</li>
 *   <li>{@code rift.stats.duration.ms} - time spent computing current stats</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter admitted;
    private final Counter duplicate;
    private final Counter rejected;
    private final Counter failed;
    private final Counter purged;
    private final Gauge lastPurgeGauge;
    private final DistributionSummary gold;
    private final DistributionSummary xp;
    private final DistributionSummary statsDuration;

    private final AtomicLong lastPurged = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "rift"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "rift");
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "emea.rift"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.admitted = Counter.builder(namePrefix + ".ingest.admitted")
                .description("Events persisted with a reward")
                .register(registry);
        this.duplicate = Counter.builder(namePrefix + ".ingest.duplicate")
                .description("Submissions collapsed as duplicates")
                .register(registry);
        this.rejected = Counter.builder(namePrefix + ".ingest.rejected")
                .description("Submissions with no matching reward rule")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".ingest.failed")
                .description("Submissions whose write failed")
                .register(registry);
        this.purged = Counter.builder(namePrefix + ".purge.deleted")
                .description("Events removed by retention purge")
                .register(registry);

        this.lastPurgeGauge = Gauge.builder(namePrefix + ".purge.last.deleted", lastPurged, AtomicLong::get)
                .description("Events removed by the latest purge cycle")
                .register(registry);

        this.gold = DistributionSummary.builder(namePrefix + ".ingest.gold")
                .description("Gold granted per admitted event")
                .register(registry);
        this.xp = DistributionSummary.builder(namePrefix + ".ingest.xp")
                .description("XP granted per admitted event")
                .register(registry);
        this.statsDuration = DistributionSummary.builder(namePrefix + ".stats.duration.ms")
                .description("Current stats computation time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementAdmitted() {
        if (closed) return;
        admitted.increment();
    }

    @Override
    public void incrementDuplicate() {
        if (closed) return;
        duplicate.increment();
    }

    @Override
    public void incrementRejected() {
        if (closed) return;
        rejected.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void recordReward(int gold, int xp) {
        if (closed) return;
        this.gold.record(gold);
        this.xp.record(xp);
    }

    @Override
    public void recordPurged(long count) {
        if (closed) return;
        lastPurged.set(count);
        if (count > 0) {
            purged.increment(count);
        }
    }

    @Override
    public void recordStatsDurationMs(long durationMs) {
        if (closed) return;
        statsDuration.record(durationMs);
    }

    /**
     * Removes every meter this exporter registered. Called when the owning
     * {@link io.rift.Rift} is closed.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(admitted, duplicate, rejected, failed, purged,
                lastPurgeGauge, gold, xp, statsDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
