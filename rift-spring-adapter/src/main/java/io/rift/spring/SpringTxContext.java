package io.rift.spring;

import io.rift.PoolExhaustedException;
import io.rift.spi.TxContext;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;

/**
 * {@link TxContext} backed by Spring's {@link TransactionSynchronizationManager}.
 *
 * <p>The ingest path writes the event row and its audit entry on the connection
 * Spring bound to the current transaction, so both commit or roll back with the
 * caller's {@code @Transactional} boundary.
 *
 * <p>Requires transaction synchronization to be active, which is Spring's default.
 * With {@code SYNCHRONIZATION_NEVER} every call except
 * {@link #isTransactionActive()} fails with {@link IllegalStateException}.
 */
public final class SpringTxContext implements TxContext {
    private final DataSource dataSource;

    public SpringTxContext(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    /**
     * @throws PoolExhaustedException if the pool timed out handing out the connection
     */
    @Override
    public Connection currentConnection() {
        requireSynchronization("obtain connection");
        try {
            return DataSourceUtils.getConnection(dataSource);
        } catch (CannotGetJdbcConnectionException e) {
            if (e.getCause() instanceof SQLTransientConnectionException) {
                throw new PoolExhaustedException("Connection pool exhausted", e.getCause());
            }
            throw e;
        }
    }

    @Override
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireSynchronization("register afterCommit callback");
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                callback.run();
            }
        });
    }

    @Override
    public void afterRollback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireSynchronization("register afterRollback callback");
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                // STATUS_UNKNOWN is treated as a rollback: nothing proves the rows landed
                if (status != STATUS_COMMITTED) {
                    callback.run();
                }
            }
        });
    }

    private void requireSynchronization(String operation) {
        if (!isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Transaction synchronization is not active; cannot " + operation);
        }
    }
}
