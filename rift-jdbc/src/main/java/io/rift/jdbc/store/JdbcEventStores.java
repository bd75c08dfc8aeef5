package io.rift.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC event stores with auto-detection from a JDBC URL.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.rift.jdbc.store.AbstractJdbcEventStore}.
 *
 * <pre>{@code
 * AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource);
 * AbstractJdbcEventStore pg = JdbcEventStores.get("postgresql");
 * }</pre>
 */
public final class JdbcEventStores {

    private static final List<AbstractJdbcEventStore> STORES;
    private static final Map<String, AbstractJdbcEventStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcEventStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcEventStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcEventStores() {
    }

    /**
     * Returns all registered event stores.
     */
    public static List<AbstractJdbcEventStore> all() {
        return STORES;
    }

    /**
     * Gets an event store by name (case-insensitive).
     *
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcEventStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcEventStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown event store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Detects the event store from a DataSource's connection URL.
     *
     * @throws IllegalStateException if the URL cannot be read
     * @throws IllegalArgumentException if no store matches the URL
     */
    public static AbstractJdbcEventStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            return detect(conn.getMetaData().getURL());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect event store from DataSource", e);
        }
    }

    /**
     * Detects the event store from a DataSource and binds it to {@code clock}.
     */
    public static AbstractJdbcEventStore detect(DataSource dataSource, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return detect(dataSource).withClock(clock);
    }

    /**
     * Detects the event store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store matches the URL
     */
    public static AbstractJdbcEventStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcEventStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("No event store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
