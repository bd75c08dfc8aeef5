package io.rift;

import io.rift.rules.StaticRuleTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventIngestorTest {
    private MutableClock clock;
    private InMemoryEventStore store;
    private RecordingMetrics metrics;
    private EventIngestor ingestor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        store = new InMemoryEventStore(clock);
        metrics = new RecordingMetrics();
        ingestor = newIngestor(StaticRuleTable.defaults());
    }

    private EventIngestor newIngestor(StaticRuleTable rules) {
        return new EventIngestor(new StubTxContext(true), store, rules,
                new DuplicateDetector(store, Duration.ofMinutes(5)), metrics, clock);
    }

    @Test
    void ingestThrowsWhenNoActiveTransaction() {
        EventIngestor noTx = new EventIngestor(new StubTxContext(false), store, StaticRuleTable.defaults());

        assertThrows(IllegalStateException.class, () ->
                noTx.ingest(IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL)));
        assertEquals(0, store.insertCalls.get());
    }

    @Test
    void admittedEventCarriesRuleReward() {
        IngestResult result = ingestor.ingest(IncomingEvent.of(Source.ZAPIER, EventType.MEETING_BOOKED));

        assertFalse(result.isDuplicate());
        assertNotNull(result.eventId());
        assertEquals(new Reward(200, 100), result.reward());
        assertEquals(1, store.size());
        assertEquals(1, metrics.admitted.get());
        assertEquals(200, metrics.gold.get());
    }

    @Test
    void admissionsAndDuplicatesLogAtInfo() {
        Logger logger = Logger.getLogger(EventIngestor.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            IncomingEvent event = IncomingEvent.of(Source.NOOKS, EventType.CALL_CONNECT);
            ingestor.ingest(event);
            ingestor.ingest(event);
        } finally {
            logger.removeHandler(handler);
        }

        assertEquals(2, records.size());
        assertEquals(Level.INFO, records.get(0).getLevel());
        assertTrue(records.get(0).getMessage().startsWith("Admitted"));
        assertEquals(Level.INFO, records.get(1).getLevel());
        assertTrue(records.get(1).getMessage().startsWith("Duplicate"));
    }

    @Test
    void repeatWithinWindowIsDuplicate() {
        IncomingEvent event = IncomingEvent.fromWire("outreach", "call_dial", Map.of("call_id", "c-1"), null);
        ingestor.ingest(event);
        clock.advance(Duration.ofMinutes(4));

        IngestResult second = ingestor.ingest(event);

        assertTrue(second.isDuplicate());
        assertNull(second.eventId());
        assertSame(Reward.NONE, second.reward());
        assertEquals(1, store.size());
        assertEquals(1, metrics.duplicates.get());
    }

    @Test
    void repeatAfterWindowIsAdmitted() {
        IncomingEvent event = IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL);
        ingestor.ingest(event);
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        IngestResult second = ingestor.ingest(event);

        assertFalse(second.isDuplicate());
        assertEquals(2, store.size());
    }

    @Test
    void differentMetadataIsNotDuplicate() {
        ingestor.ingest(IncomingEvent.fromWire("outreach", "call_dial", Map.of("call_id", "c-1"), null));

        IngestResult other = ingestor.ingest(
                IncomingEvent.fromWire("outreach", "call_dial", Map.of("call_id", "c-2"), null));

        assertFalse(other.isDuplicate());
        assertEquals(2, store.size());
    }

    @Test
    void differentSourceIsNotDuplicate() {
        ingestor.ingest(IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL));

        IngestResult other = ingestor.ingest(IncomingEvent.of(Source.MANUAL, EventType.CALL_DIAL));

        assertFalse(other.isDuplicate());
    }

    @Test
    void missingRuleRejectsWithoutWriting() {
        EventIngestor partial = newIngestor(StaticRuleTable.of(Rule.of(EventType.CALL_DIAL, 10, 5)));

        RuleNotFoundException e = assertThrows(RuleNotFoundException.class, () ->
                partial.ingest(IncomingEvent.of(Source.NOOKS, EventType.EMAIL_SENT)));

        assertEquals(EventType.EMAIL_SENT, e.eventType());
        assertTrue(e.getMessage().contains("email_sent"));
        assertEquals(0, store.insertCalls.get());
        assertEquals(1, metrics.rejected.get());
    }

    @Test
    void rewardIsCopiedAtAdmissionTime() {
        ingestor.ingest(IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL));
        EventIngestor changed = newIngestor(StaticRuleTable.of(Rule.of(EventType.CALL_DIAL, 99, 77)));
        clock.advance(Duration.ofMinutes(10));

        IngestResult result = changed.ingest(IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL));

        assertEquals(new Reward(99, 77), result.reward());
        assertEquals(new Reward(10, 5), store.events.get(0).event().reward());
    }

    @Test
    void storeFailurePropagatesAndCountsFailure() {
        store.failInsertWith = new EventStoreException("disk full", null);

        assertThrows(EventStoreException.class, () ->
                ingestor.ingest(IncomingEvent.of(Source.OUTREACH, EventType.CALL_CONNECT)));
        assertEquals(1, metrics.failed.get());
        assertEquals(0, metrics.admitted.get());
    }

    @Test
    void idempotencyKeyCollisionIsReportedAsDuplicate() {
        IncomingEvent event = IncomingEvent.of(Source.OUTREACH, EventType.CALL_DIAL);
        ingestor.ingest(event);
        // Hides the first row from the read check, as a concurrent uncommitted insert would be.
        store.events.set(0, new InMemoryEventStore.Stored("evt-1", store.events.get(0).event(),
                clock.instant().minus(Duration.ofHours(1))));

        IngestResult result = ingestor.ingest(event);

        assertTrue(result.isDuplicate());
        assertEquals(1, store.size());
    }
}
