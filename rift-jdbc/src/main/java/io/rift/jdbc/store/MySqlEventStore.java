package io.rift.jdbc.store;

import java.time.Clock;
import java.util.List;

/**
 * MySQL event store. Also compatible with TiDB and MariaDB.
 *
 * <p>MySQL keeps the transaction usable after a duplicate-key error, so the
 * default savepoint-guarded insert applies unchanged.
 */
public final class MySqlEventStore extends AbstractJdbcEventStore {

    public MySqlEventStore() {
        super();
    }

    public MySqlEventStore(Clock clock) {
        super(clock);
    }

    @Override
    public AbstractJdbcEventStore withClock(Clock clock) {
        return new MySqlEventStore(clock);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
    }
}
