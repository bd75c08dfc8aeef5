package io.rift.jdbc.purge;

/**
 * PostgreSQL purger. Uses the default subquery-based {@code DELETE}.
 */
public final class PostgresEventPurger extends AbstractJdbcEventPurger {
}
