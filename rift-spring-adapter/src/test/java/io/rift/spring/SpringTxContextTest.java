package io.rift.spring;

import io.rift.EventIngestor;
import io.rift.EventType;
import io.rift.IncomingEvent;
import io.rift.IngestResult;
import io.rift.Source;
import io.rift.jdbc.JdbcTemplate;
import io.rift.jdbc.store.H2EventStore;
import io.rift.rules.StaticRuleTable;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringTxContextTest {
    private JdbcDataSource dataSource;
    private SpringTxContext txContext;
    private TransactionTemplate tx;
    private EventIngestor ingestor;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:rift_spring_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
        txContext = new SpringTxContext(dataSource);
        tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        ingestor = new EventIngestor(txContext, new H2EventStore(), StaticRuleTable.defaults());

        String ddl;
        try (InputStream is = getClass().getResourceAsStream("/schema/h2.sql")) {
            assertNotNull(is);
            ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection(); Statement s = conn.createStatement()) {
            for (String stmt : ddl.split(";")) {
                if (!stmt.isBlank()) {
                    s.execute(stmt.trim());
                }
            }
        }
    }

    private IncomingEvent dial(String callId) {
        return IncomingEvent.fromWire("outreach", "call_dial", Map.of("call_id", callId), null);
    }

    @Test
    void committedIngestIsVisible() throws Exception {
        IngestResult result = tx.execute(status -> ingestor.ingest(dial("c-1")));

        assertNotNull(result);
        assertFalse(result.isDuplicate());
        assertEquals(1, count("events"));
        assertEquals(1, count("event_log"));
    }

    @Test
    void rolledBackIngestLeavesNothing() throws Exception {
        tx.executeWithoutResult(status -> {
            ingestor.ingest(dial("c-2"));
            status.setRollbackOnly();
        });

        assertEquals(0, count("events"));
        assertEquals(0, count("event_log"));
    }

    @Test
    void exceptionInsideTransactionRollsBackIngest() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.executeWithoutResult(status -> {
            ingestor.ingest(dial("c-3"));
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, count("events"));
    }

    @Test
    void duplicateInSameTransactionIsDetected() {
        IngestResult second = tx.execute(status -> {
            ingestor.ingest(dial("c-4"));
            return ingestor.ingest(dial("c-4"));
        });

        assertNotNull(second);
        assertTrue(second.isDuplicate());
    }

    @Test
    void afterCommitRunsOnlyOnCommit() {
        AtomicBoolean committed = new AtomicBoolean();
        AtomicBoolean rolledBack = new AtomicBoolean();

        tx.executeWithoutResult(status -> {
            txContext.afterCommit(() -> committed.set(true));
            txContext.afterRollback(() -> rolledBack.set(true));
        });

        assertTrue(committed.get());
        assertFalse(rolledBack.get());
    }

    @Test
    void afterRollbackRunsOnRollback() {
        AtomicBoolean committed = new AtomicBoolean();
        AtomicBoolean rolledBack = new AtomicBoolean();

        tx.executeWithoutResult(status -> {
            txContext.afterCommit(() -> committed.set(true));
            txContext.afterRollback(() -> rolledBack.set(true));
            status.setRollbackOnly();
        });

        assertFalse(committed.get());
        assertTrue(rolledBack.get());
    }

    @Test
    void outsideTransactionEverythingButProbeFails() {
        assertFalse(txContext.isTransactionActive());
        assertThrows(IllegalStateException.class, txContext::currentConnection);
        assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
        assertThrows(IllegalStateException.class, () -> txContext.afterRollback(() -> { }));
        assertThrows(IllegalStateException.class, () -> ingestor.ingest(dial("c-5")));
    }

    private long count(String table) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + table);
        }
    }
}
