package io.rift.jdbc.purge;

import io.rift.jdbc.JdbcTemplate;
import io.rift.spi.EventPurger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Base JDBC purger that deletes events older than a cutoff, oldest first.
 * Audit entries go with them through {@code ON DELETE CASCADE}.
 *
 * <p>The default statement limits the batch with a subquery, which works for H2
 * and PostgreSQL. MySQL overrides with {@code DELETE ... ORDER BY ... LIMIT}.
 *
 * @see H2EventPurger
 * @see MySqlEventPurger
 * @see PostgresEventPurger
 */
public abstract class AbstractJdbcEventPurger implements EventPurger {
    protected static final String EVENTS_TABLE = "events";

    @Override
    public int purge(Connection conn, Instant before, int limit) {
        String sql = "DELETE FROM " + EVENTS_TABLE + " WHERE id IN (" +
                "SELECT id FROM " + EVENTS_TABLE +
                " WHERE created_at < ?" +
                " ORDER BY created_at LIMIT ?)";
        return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
    }

    @Override
    public long countOlderThan(Connection conn, Instant before) {
        return JdbcTemplate.queryForLong(conn,
                "SELECT COUNT(*) FROM " + EVENTS_TABLE + " WHERE created_at < ?", Timestamp.from(before));
    }
}
