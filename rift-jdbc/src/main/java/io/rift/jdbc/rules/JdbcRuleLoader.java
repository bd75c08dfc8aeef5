package io.rift.jdbc.rules;

import io.rift.EventStoreException;
import io.rift.EventType;
import io.rift.InvalidEventException;
import io.rift.Reward;
import io.rift.Rule;
import io.rift.jdbc.JdbcTemplate;
import io.rift.rules.StaticRuleTable;
import io.rift.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Snapshots the {@code rules} table into a {@link StaticRuleTable}.
 *
 * <p>Rows whose {@code event_type} is not part of the vocabulary are skipped
 * with a warning. Changes to the table take effect on the next load.
 */
public final class JdbcRuleLoader {
    private static final Logger logger = Logger.getLogger(JdbcRuleLoader.class.getName());

    private static final String SELECT_RULES =
            "SELECT event_type, gold_value, xp_value, display_name, description FROM rules ORDER BY event_type";

    private final ConnectionProvider connectionProvider;

    public JdbcRuleLoader(ConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    /**
     * Loads the current rules on a fresh connection.
     *
     * @throws EventStoreException if the table cannot be read
     */
    public StaticRuleTable load() {
        try (Connection conn = connectionProvider.getConnection()) {
            return load(conn);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to obtain connection for rule loading", e);
        }
    }

    /**
     * Loads the current rules on {@code conn}.
     */
    public static StaticRuleTable load(Connection conn) {
        List<Rule> rules = new ArrayList<>();
        JdbcTemplate.forEach(conn, SELECT_RULES, rs -> {
            String type = rs.getString(1);
            EventType eventType;
            try {
                eventType = EventType.fromWire(type);
            } catch (InvalidEventException e) {
                logger.log(Level.WARNING, "Ignoring rule for unknown event type: {0}", type);
                return;
            }
            rules.add(new Rule(eventType, new Reward(rs.getInt(2), rs.getInt(3)), rs.getString(4), rs.getString(5)));
        });
        StaticRuleTable table = StaticRuleTable.of(rules);
        logger.log(Level.INFO, "Loaded {0} reward rules", rules.size());
        return table;
    }
}
