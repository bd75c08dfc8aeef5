package io.rift;

import io.rift.purge.RetentionPurgeScheduler;
import io.rift.spi.ConnectionProvider;
import io.rift.spi.EventPurger;
import io.rift.spi.EventStore;
import io.rift.spi.MetricsExporter;
import io.rift.spi.RuleTable;
import io.rift.spi.TxContext;
import io.rift.stats.StatsAggregator;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires an {@link EventIngestor}, a
 * {@link StatsAggregator} and an optional {@link RetentionPurgeScheduler} into
 * a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Rift rift = Rift.builder()
 *     .connectionProvider(connProvider)
 *     .txContext(txContext)
 *     .eventStore(store)
 *     .ruleTable(StaticRuleTable.defaults())
 *     .build()) {
 *   try (var tx = txManager.begin()) {
 *     rift.ingestor().ingest(IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL));
 *     tx.commit();
 *   }
 *   DerivedStats stats = rift.stats().currentStats();
 * }
 * }</pre>
 */
public final class Rift implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Rift.class.getName());

    private final EventIngestor ingestor;
    private final StatsAggregator stats;
    private final RetentionPurgeScheduler purgeScheduler;
    private final MetricsExporter metrics;

    private Rift(EventIngestor ingestor, StatsAggregator stats,
                 RetentionPurgeScheduler purgeScheduler, MetricsExporter metrics) {
        this.ingestor = ingestor;
        this.stats = stats;
        this.purgeScheduler = purgeScheduler;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Ingestor for use inside the caller's transactions. */
    public EventIngestor ingestor() {
        return ingestor;
    }

    /** Read-side aggregator. */
    public StatsAggregator stats() {
        return stats;
    }

    /** The purge scheduler, or {@code null} if no purger was configured. */
    public RetentionPurgeScheduler purgeScheduler() {
        return purgeScheduler;
    }

    /**
     * Stops the purge scheduler and releases the metrics exporter if it is closeable.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        if (purgeScheduler != null) {
            try {
                purgeScheduler.close();
            } catch (RuntimeException e) {
                first = e;
            }
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /** Builder for {@link Rift}. A builder can be used once. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private TxContext txContext;
        private EventStore eventStore;
        private RuleTable ruleTable;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration duplicateWindow = DuplicateDetector.DEFAULT_WINDOW;
        private ZoneId statsZone = ZoneId.of("UTC");
        private EventPurger purger;
        private Duration purgeRetention;
        private int purgeBatchSize = 500;
        private long purgeIntervalSeconds = 3600;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {}

        /** <b>Required.</b> Connections for stats reads and purge batches. */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> Access to the caller's transaction for ingestion. */
        public Builder txContext(TxContext txContext) {
            this.txContext = txContext;
            return this;
        }

        /** <b>Required.</b> */
        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder ruleTable(RuleTable ruleTable) {
            this.ruleTable = ruleTable;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Sliding duplicate window. Optional, defaults to 5 minutes. */
        public Builder duplicateWindow(Duration duplicateWindow) {
            this.duplicateWindow = duplicateWindow;
            return this;
        }

        /** Zone that defines calendar days for stats. Optional, defaults to UTC. */
        public Builder statsZone(ZoneId statsZone) {
            this.statsZone = statsZone;
            return this;
        }

        /**
         * Enables the retention purge scheduler, which is started by {@link #build()}.
         * Optional.
         */
        public Builder purger(EventPurger purger) {
            this.purger = purger;
            return this;
        }

        public Builder purgeRetention(Duration purgeRetention) {
            this.purgeRetention = purgeRetention;
            return this;
        }

        public Builder purgeBatchSize(int purgeBatchSize) {
            this.purgeBatchSize = purgeBatchSize;
            return this;
        }

        public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
            this.purgeIntervalSeconds = purgeIntervalSeconds;
            return this;
        }

        /**
         * Builds the composite.
         *
         * @throws NullPointerException if a required component is missing
         * @throws IllegalStateException if called twice
         */
        public Rift build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            Objects.requireNonNull(connectionProvider, "connectionProvider");
            Objects.requireNonNull(txContext, "txContext");
            Objects.requireNonNull(eventStore, "eventStore");
            Objects.requireNonNull(ruleTable, "ruleTable");
            Objects.requireNonNull(statsZone, "statsZone");

            MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
            Clock c = clock != null ? clock : Clock.systemUTC();

            DuplicateDetector detector = new DuplicateDetector(eventStore, duplicateWindow);
            EventIngestor ingestor = new EventIngestor(txContext, eventStore, ruleTable, detector, m, c);
            StatsAggregator stats = new StatsAggregator(connectionProvider, eventStore, statsZone, c, m);

            RetentionPurgeScheduler scheduler = null;
            if (purger != null) {
                scheduler = RetentionPurgeScheduler.builder()
                        .connectionProvider(connectionProvider)
                        .purger(purger)
                        .metrics(m)
                        .clock(c)
                        .retention(purgeRetention)
                        .batchSize(purgeBatchSize)
                        .intervalSeconds(purgeIntervalSeconds)
                        .build();
                scheduler.start();
                logger.log(Level.INFO, "Retention purge scheduled every {0}s, keeping {1}",
                        new Object[]{purgeIntervalSeconds, scheduler.retention()});
            }
            return new Rift(ingestor, stats, scheduler, m);
        }
    }
}
