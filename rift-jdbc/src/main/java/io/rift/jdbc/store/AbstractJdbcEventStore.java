package io.rift.jdbc.store;

import com.github.f4b6a3.ulid.UlidCreator;
import io.rift.EventMetadata;
import io.rift.EventStoreException;
import io.rift.EventType;
import io.rift.Source;
import io.rift.jdbc.JdbcTemplate;
import io.rift.model.EventRow;
import io.rift.model.EventTotals;
import io.rift.model.NewEvent;
import io.rift.spi.EventStore;
import io.rift.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Base JDBC event store using standard SQL.
 *
 * <p>Writes go to {@code events} and {@code event_log}; reads use the same
 * tables. Subclasses supply the database name and JDBC URL prefixes used for
 * auto-detection and may override individual statements.
 *
 * <p>Ids are monotonic ULIDs. {@code created_at} is taken from the store's clock
 * at millisecond precision and never moves backwards within one store instance.
 *
 * <p>The default event insert runs under a savepoint and maps an integrity
 * violation on the idempotency key to "not inserted", which keeps the caller's
 * transaction usable.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore implements EventStore {
    protected static final String EVENTS_TABLE = "events";
    protected static final String AUDIT_TABLE = "event_log";
    protected static final String ACTION_CREATED = "created";

    protected static final String EVENT_COLUMNS =
            "id, source, event_type, gold_value, xp_value, metadata, metadata_hash, dedup_key, reported_at, created_at";

    private final Clock clock;
    private final JsonCodec jsonCodec;
    private final AtomicReference<Instant> lastCreatedAt = new AtomicReference<>(Instant.EPOCH);

    protected AbstractJdbcEventStore() {
        this(Clock.systemUTC());
    }

    protected AbstractJdbcEventStore(Clock clock) {
        this(clock, JsonCodec.getDefault());
    }

    protected AbstractJdbcEventStore(Clock clock, JsonCodec jsonCodec) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    /**
     * Returns the unique identifier for this store (e.g. "h2", "mysql", "postgresql").
     */
    public abstract String name();

    /**
     * Returns JDBC URL prefixes this store handles, for auto-detection.
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a copy of this store that reads time from {@code clock}.
     */
    public abstract AbstractJdbcEventStore withClock(Clock clock);

    protected Clock clock() {
        return clock;
    }

    protected JsonCodec jsonCodec() {
        return jsonCodec;
    }

    @Override
    public Optional<String> insert(Connection conn, NewEvent event) {
        Objects.requireNonNull(event, "event");
        String id = UlidCreator.getMonotonicUlid().toString();
        Instant createdAt = nextCreatedAt();
        if (!insertEvent(conn, id, event, createdAt)) {
            return Optional.empty();
        }
        insertAuditEntry(conn, id, event, createdAt);
        return Optional.of(id);
    }

    /**
     * Inserts the event row.
     *
     * @return {@code false} if the idempotency key is already taken
     */
    protected boolean insertEvent(Connection conn, String id, NewEvent event, Instant createdAt) {
        String sql = "INSERT INTO " + EVENTS_TABLE + " (" + EVENT_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
        Savepoint savepoint = savepointIfTransactional(conn);
        try {
            JdbcTemplate.update(conn, sql, eventParams(id, event, createdAt));
        } catch (EventStoreException e) {
            if (e.getCause() instanceof SQLException cause && JdbcTemplate.isConstraintViolation(cause)) {
                rollbackTo(conn, savepoint);
                if (dedupKeyExists(conn, event.idempotencyKey())) {
                    return false;
                }
            }
            throw e;
        }
        release(conn, savepoint);
        return true;
    }

    private boolean dedupKeyExists(Connection conn, String dedupKey) {
        return JdbcTemplate.queryForLong(conn,
                "SELECT COUNT(*) FROM " + EVENTS_TABLE + " WHERE dedup_key=?", dedupKey) > 0;
    }

    private static Savepoint savepointIfTransactional(Connection conn) {
        try {
            return conn.getAutoCommit() ? null : conn.setSavepoint();
        } catch (SQLException e) {
            throw new EventStoreException("Failed to set savepoint", e);
        }
    }

    private static void rollbackTo(Connection conn, Savepoint savepoint) {
        if (savepoint == null) {
            return;
        }
        try {
            conn.rollback(savepoint);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to roll back to savepoint", e);
        }
    }

    private static void release(Connection conn, Savepoint savepoint) {
        if (savepoint == null) {
            return;
        }
        try {
            conn.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to release savepoint", e);
        }
    }

    protected Object[] eventParams(String id, NewEvent event, Instant createdAt) {
        EventMetadata metadata = event.metadata();
        return new Object[]{
                id,
                event.source().wireName(),
                event.eventType().wireName(),
                event.reward().gold(),
                event.reward().xp(),
                metadata.canonicalJson(),
                metadata.fingerprint(),
                event.idempotencyKey(),
                event.reportedAt() == null ? null : Timestamp.from(event.reportedAt()),
                Timestamp.from(createdAt)
        };
    }

    /**
     * Writes the single audit entry that accompanies an inserted event.
     */
    protected void insertAuditEntry(Connection conn, String eventId, NewEvent event, Instant createdAt) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", event.source().wireName());
        details.put("event_type", event.eventType().wireName());
        details.put("gold_value", event.reward().gold());
        details.put("xp_value", event.reward().xp());
        if (event.reportedAt() != null) {
            details.put("reported_at", event.reportedAt().toString());
        }
        String sql = "INSERT INTO " + AUDIT_TABLE + " (id, event_id, action, details, created_at) VALUES (?,?,?,?,?)";
        JdbcTemplate.update(conn, sql,
                UlidCreator.getMonotonicUlid().toString(),
                eventId,
                ACTION_CREATED,
                jsonCodec.toCanonicalJson(details),
                Timestamp.from(createdAt));
    }

    @Override
    public boolean existsSince(Connection conn, Source source, EventType eventType,
                               EventMetadata metadata, Instant since) {
        String sql = "SELECT id FROM " + EVENTS_TABLE +
                " WHERE source=? AND event_type=? AND metadata_hash=? AND created_at >= ?" +
                " LIMIT 1";
        return !JdbcTemplate.query(conn, sql, rs -> rs.getString(1),
                source.wireName(), eventType.wireName(), metadata.fingerprint(), Timestamp.from(since)).isEmpty();
    }

    @Override
    public List<EventTotals> aggregateByType(Connection conn, Instant dayStart, Instant dayEnd) {
        String sql = "SELECT event_type, COUNT(*), COALESCE(SUM(gold_value), 0), COALESCE(SUM(xp_value), 0)," +
                " SUM(CASE WHEN created_at >= ? AND created_at < ? THEN 1 ELSE 0 END)" +
                " FROM " + EVENTS_TABLE + " GROUP BY event_type";
        return JdbcTemplate.query(conn, sql, rs -> new EventTotals(
                        EventType.fromWire(rs.getString(1)),
                        rs.getLong(2),
                        rs.getLong(3),
                        rs.getLong(4),
                        rs.getLong(5)),
                Timestamp.from(dayStart), Timestamp.from(dayEnd));
    }

    @Override
    public void forEachCreatedSince(Connection conn, Instant since, Consumer<EventRow> consumer) {
        String sql = "SELECT id, source, event_type, gold_value, xp_value, created_at FROM " + EVENTS_TABLE +
                " WHERE created_at >= ? ORDER BY created_at, id";
        JdbcTemplate.forEach(conn, sql, rs -> consumer.accept(new EventRow(
                        rs.getString(1),
                        Source.fromWire(rs.getString(2)),
                        EventType.fromWire(rs.getString(3)),
                        rs.getInt(4),
                        rs.getInt(5),
                        rs.getTimestamp(6).toInstant())),
                Timestamp.from(since));
    }

    /** Next creation time: the clock reading, unless an earlier insert already used a later one. */
    protected Instant nextCreatedAt() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return lastCreatedAt.accumulateAndGet(now, (prev, cur) -> cur.isAfter(prev) ? cur : prev);
    }
}
