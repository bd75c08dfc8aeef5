package io.rift.jdbc.tx;

import io.rift.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for manual JDBC usage. Obtains a connection, disables
 * auto-commit and binds it to a {@link ThreadLocalTxContext}.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     ingestor.ingest(event);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
    private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ThreadLocalTxContext txContext;

    public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.txContext = Objects.requireNonNull(txContext, "txContext");
    }

    /**
     * Begins a transaction bound to the current thread.
     *
     * @return the transaction handle, for use with try-with-resources
     * @throws SQLException if a connection cannot be obtained
     */
    public Transaction begin() throws SQLException {
        Connection connection = connectionProvider.getConnection();
        try {
            connection.setAutoCommit(false);
            txContext.bind(connection);
        } catch (SQLException | RuntimeException e) {
            connection.close();
            throw e;
        }
        return new Transaction(connection, txContext);
    }

    /**
     * An active transaction. If neither {@link #commit()} nor {@link #rollback()}
     * is called, {@link #close()} rolls back.
     */
    public static final class Transaction implements AutoCloseable {
        private final Connection connection;
        private final ThreadLocalTxContext txContext;
        private boolean completed;

        private Transaction(Connection connection, ThreadLocalTxContext txContext) {
            this.connection = connection;
            this.txContext = txContext;
        }

        public void commit() throws SQLException {
            if (completed) {
                return;
            }
            boolean committed = false;
            try {
                connection.commit();
                committed = true;
            } catch (SQLException e) {
                rollbackAfterFailedCommit(e);
                throw e;
            } finally {
                finish(committed);
            }
        }

        public void rollback() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.rollback();
            } finally {
                finish(false);
            }
        }

        @Override
        public void close() throws SQLException {
            if (!completed) {
                rollback();
            }
        }

        private void finish(boolean committed) throws SQLException {
            RuntimeException callbackException = null;
            try {
                if (committed) {
                    txContext.clearAfterCommit();
                } else {
                    txContext.clearAfterRollback();
                }
            } catch (RuntimeException e) {
                callbackException = e;
            } finally {
                completed = true;
                try {
                    connection.setAutoCommit(true);
                } catch (SQLException e) {
                    if (callbackException != null) callbackException.addSuppressed(e);
                } finally {
                    connection.close();
                }
            }
            if (callbackException != null) {
                throw callbackException;
            }
        }

        private void rollbackAfterFailedCommit(SQLException commitFailure) {
            try {
                connection.rollback();
            } catch (SQLException e) {
                commitFailure.addSuppressed(e);
                logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
            }
        }
    }
}
