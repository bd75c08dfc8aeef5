package io.rift;

import io.rift.model.NewEvent;
import io.rift.spi.EventStore;
import io.rift.spi.MetricsExporter;
import io.rift.spi.RuleTable;
import io.rift.spi.TxContext;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admits activity events within the caller's transaction.
 *
 * <p>Each call runs the duplicate check, resolves the reward from the rule table
 * and persists the event together with its audit entry. Everything happens on
 * the connection exposed by {@link TxContext}, so a failure leaves nothing
 * behind once the caller rolls back.
 *
 * <p>Requires an active transaction; throws {@link IllegalStateException} otherwise.
 *
 * @see Rift
 */
public final class EventIngestor {
    private static final Logger logger = Logger.getLogger(EventIngestor.class.getName());

    private final TxContext txContext;
    private final EventStore eventStore;
    private final RuleTable ruleTable;
    private final DuplicateDetector duplicateDetector;
    private final MetricsExporter metrics;
    private final Clock clock;

    public EventIngestor(TxContext txContext, EventStore eventStore, RuleTable ruleTable) {
        this(txContext, eventStore, ruleTable, new DuplicateDetector(eventStore),
                MetricsExporter.NOOP, Clock.systemUTC());
    }

    public EventIngestor(TxContext txContext, EventStore eventStore, RuleTable ruleTable,
                         DuplicateDetector duplicateDetector, MetricsExporter metrics, Clock clock) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable");
        this.duplicateDetector = Objects.requireNonNull(duplicateDetector, "duplicateDetector");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Admits one event.
     *
     * @param event the validated event
     * @return the admitted event's id and reward, or the duplicate outcome
     * @throws IllegalStateException if no transaction is active
     * @throws RuleNotFoundException if the event type has no reward rule
     * @throws EventStoreException if persistence fails; the caller must roll back
     */
    public IngestResult ingest(IncomingEvent event) {
        Objects.requireNonNull(event, "event");
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Connection conn = txContext.currentConnection();
        Instant now = clock.instant();

        if (duplicateDetector.isDuplicate(conn, event, now)) {
            metrics.incrementDuplicate();
            logger.log(Level.INFO, "Duplicate {0}/{1} ignored",
                    new Object[]{event.source().wireName(), event.eventType().wireName()});
            return IngestResult.duplicate();
        }

        Reward reward;
        try {
            reward = ruleTable.resolve(event.eventType());
        } catch (RuleNotFoundException e) {
            metrics.incrementRejected();
            logger.log(Level.WARNING, e.getMessage());
            throw e;
        }

        NewEvent newEvent = new NewEvent(event.source(), event.eventType(), reward,
                event.metadata(), event.reportedAt(), duplicateDetector.idempotencyKey(event, now));
        Optional<String> eventId;
        try {
            eventId = eventStore.insert(conn, newEvent);
        } catch (RuntimeException e) {
            metrics.incrementFailed();
            logger.log(Level.SEVERE, "Failed to persist " + event.eventType().wireName() + " event", e);
            throw e;
        }

        if (eventId.isEmpty()) {
            metrics.incrementDuplicate();
            logger.log(Level.INFO, "Concurrent duplicate {0}/{1} collapsed on idempotency key",
                    new Object[]{event.source().wireName(), event.eventType().wireName()});
            return IngestResult.duplicate();
        }

        metrics.incrementAdmitted();
        metrics.recordReward(reward.gold(), reward.xp());
        logger.log(Level.INFO, "Admitted {0} event {1} (+{2} gold, +{3} xp)",
                new Object[]{event.eventType().wireName(), eventId.get(), reward.gold(), reward.xp()});
        return IngestResult.admitted(eventId.get(), reward);
    }
}
