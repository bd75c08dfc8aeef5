package io.rift.jdbc.purge;

import io.rift.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * MySQL purger. Also compatible with TiDB and MariaDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so this uses
 * {@code DELETE ... ORDER BY ... LIMIT} directly.
 */
public final class MySqlEventPurger extends AbstractJdbcEventPurger {

    @Override
    public int purge(Connection conn, Instant before, int limit) {
        String sql = "DELETE FROM " + EVENTS_TABLE +
                " WHERE created_at < ?" +
                " ORDER BY created_at LIMIT ?";
        return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
    }
}
