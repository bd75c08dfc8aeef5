package io.rift.jdbc.store;

import java.time.Clock;
import java.util.List;

/**
 * H2 event store. Uses the default SQL from {@link AbstractJdbcEventStore}.
 */
public final class H2EventStore extends AbstractJdbcEventStore {

    public H2EventStore() {
        super();
    }

    public H2EventStore(Clock clock) {
        super(clock);
    }

    @Override
    public AbstractJdbcEventStore withClock(Clock clock) {
        return new H2EventStore(clock);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }
}
