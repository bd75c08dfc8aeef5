package io.rift.jdbc.store;

import io.rift.jdbc.JdbcTemplate;
import io.rift.model.NewEvent;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL event store.
 *
 * <p>Inserts with {@code ON CONFLICT (dedup_key) DO NOTHING}: a failed statement
 * would otherwise abort the whole transaction, and this avoids the savepoint
 * round-trips.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {

    public PostgresEventStore() {
        super();
    }

    public PostgresEventStore(Clock clock) {
        super(clock);
    }

    @Override
    public AbstractJdbcEventStore withClock(Clock clock) {
        return new PostgresEventStore(clock);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    protected boolean insertEvent(Connection conn, String id, NewEvent event, Instant createdAt) {
        String sql = "INSERT INTO " + EVENTS_TABLE + " (" + EVENT_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)" +
                " ON CONFLICT (dedup_key) DO NOTHING";
        return JdbcTemplate.update(conn, sql, eventParams(id, event, createdAt)) > 0;
    }
}
