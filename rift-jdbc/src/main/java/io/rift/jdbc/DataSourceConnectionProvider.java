package io.rift.jdbc;

import io.rift.PoolExhaustedException;
import io.rift.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>A pool that times out waiting for a free connection reports
 * {@link SQLTransientConnectionException} (HikariCP does); that is rethrown as
 * {@link PoolExhaustedException} so callers can tell saturation apart from an
 * unreachable database.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
    private final DataSource dataSource;

    public DataSourceConnectionProvider(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Connection getConnection() throws SQLException {
        try {
            return dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            throw new PoolExhaustedException("Connection pool exhausted", e);
        }
    }
}
