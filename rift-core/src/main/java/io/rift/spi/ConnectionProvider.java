package io.rift.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections for work outside the caller's transaction: stats
 * reads, health probes and purge batches.
 */
public interface ConnectionProvider {

    /**
     * Obtains a connection. The caller is responsible for closing it.
     *
     * @return a connection
     * @throws SQLException if no connection can be obtained
     */
    Connection getConnection() throws SQLException;
}
