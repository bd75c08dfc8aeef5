package io.rift.jdbc.purge;

/**
 * H2 purger. Uses the default subquery-based {@code DELETE}.
 */
public final class H2EventPurger extends AbstractJdbcEventPurger {
}
