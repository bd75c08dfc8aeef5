package io.rift.spi;

/**
 * Observability hook for ingestion, stats and purge activity.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to
 * bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /** An event was admitted and persisted. */
    void incrementAdmitted();

    /** An event was recognised as a duplicate and dropped. */
    void incrementDuplicate();

    /** An event was rejected because no reward rule exists for its type. */
    void incrementRejected();

    /** Persisting an event failed and the caller's transaction will roll back. */
    void incrementFailed();

    /** Records the reward granted to an admitted event. */
    default void recordReward(int gold, int xp) {
    }

    /** Records the number of events removed by one purge cycle. */
    default void recordPurged(long count) {
    }

    /** Records how long a stats computation took. */
    default void recordStatsDurationMs(long durationMs) {
    }

    /** No-op implementation of {@link MetricsExporter}. */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAdmitted() {
        }

        @Override
        public void incrementDuplicate() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void incrementFailed() {
        }
    }
}
