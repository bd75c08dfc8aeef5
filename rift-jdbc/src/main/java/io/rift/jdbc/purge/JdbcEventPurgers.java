package io.rift.jdbc.purge;

import io.rift.spi.EventPurger;

/**
 * Picks the purger that matches an event store's database name.
 */
public final class JdbcEventPurgers {

    private JdbcEventPurgers() {
    }

    /**
     * @param dbName store name as returned by
     *               {@link io.rift.jdbc.store.AbstractJdbcEventStore#name()}
     * @throws IllegalStateException if no purger exists for {@code dbName}
     */
    public static EventPurger forDatabase(String dbName) {
        return switch (dbName) {
            case "h2" -> new H2EventPurger();
            case "mysql" -> new MySqlEventPurger();
            case "postgresql" -> new PostgresEventPurger();
            default -> throw new IllegalStateException("No purger available for database: " + dbName);
        };
    }
}
