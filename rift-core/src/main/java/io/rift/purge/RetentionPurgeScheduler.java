package io.rift.purge;

import io.rift.EventStoreException;
import io.rift.spi.ConnectionProvider;
import io.rift.spi.EventPurger;
import io.rift.spi.MetricsExporter;
import io.rift.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes events older than the retention period on a fixed schedule.
 *
 * <p>Each cycle deletes in batches until a batch comes back short. Every batch
 * runs on its own auto-committed connection to keep lock time low. Audit
 * entries are removed with their event by the foreign key cascade.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see EventPurger
 */
public final class RetentionPurgeScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetentionPurgeScheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventPurger purger;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration retention;
    private final int batchSize;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> purgeTask;
    private volatile boolean closed;

    private RetentionPurgeScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.purger = Objects.requireNonNull(builder.purger, "purger");

        if (builder.retention != null && builder.retention.isNegative()) {
            throw new IllegalArgumentException("retention must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }

        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.retention = builder.retention != null ? builder.retention : Duration.ofDays(90);
        this.batchSize = builder.batchSize;
        this.intervalSeconds = builder.intervalSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration retention() {
        return retention;
    }

    /**
     * Starts the scheduled purge loop. Later calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetentionPurgeScheduler has been closed");
        }
        if (purgeTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("rift-purge-"));
        purgeTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Runs one purge cycle. Failures are logged and the cycle ends early;
     * the next scheduled cycle retries.
     *
     * @return number of events deleted in this cycle
     */
    public long runOnce() {
        if (closed) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(retention);
        long totalDeleted = 0;
        try {
            int deleted;
            do {
                deleted = purgeBatch(cutoff);
                totalDeleted += deleted;
            } while (deleted >= batchSize);
        } catch (SQLException | EventStoreException e) {
            logger.log(Level.SEVERE, "Purge cycle failed after deleting " + totalDeleted + " events", e);
        }
        if (totalDeleted > 0) {
            logger.log(Level.INFO, "Purged {0} events older than {1}", new Object[]{totalDeleted, cutoff});
        }
        metrics.recordPurged(totalDeleted);
        return totalDeleted;
    }

    /**
     * Counts the events the next cycle would delete, without deleting anything.
     *
     * @throws EventStoreException if the count fails
     */
    public long countEligible() {
        Instant cutoff = clock.instant().minus(retention);
        try (Connection conn = connectionProvider.getConnection()) {
            return purger.countOlderThan(conn, cutoff);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection for purge count", e);
        }
    }

    private int purgeBatch(Instant cutoff) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return purger.purge(conn, cutoff, batchSize);
        }
    }

    /** Cancels the schedule and shuts down the purge thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (purgeTask != null) {
            purgeTask.cancel(false);
            purgeTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link RetentionPurgeScheduler}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventPurger purger;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration retention;
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        private Builder() {}

        /** <b>Required.</b> Source of connections for purge batches. */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> Dialect-specific delete strategy. */
        public Builder purger(EventPurger purger) {
            this.purger = purger;
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

        /**
         * Sets how long events are kept. Optional, defaults to {@code 90 days}. Must be &ge; 0.
         */
        public Builder retention(Duration retention) {
            this.retention = retention;
            return this;
        }

        /** Maximum events deleted per batch. Optional, defaults to {@code 500}. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Seconds between cycles. Optional, defaults to {@code 3600}. */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * Builds the scheduler. Call {@link RetentionPurgeScheduler#start()} to begin.
         *
         * @throws NullPointerException if {@code connectionProvider} or {@code purger} is null
         * @throws IllegalArgumentException if {@code retention} is negative,
         *     {@code batchSize <= 0}, or {@code intervalSeconds <= 0}
         */
        public RetentionPurgeScheduler build() {
            return new RetentionPurgeScheduler(this);
        }
    }
}
