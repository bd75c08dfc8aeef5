package io.rift.jdbc.tx;

import io.rift.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} implementation that keeps transaction state in a {@link ThreadLocal}.
 *
 * <p>Meant for manual JDBC usage together with {@link JdbcTransactionManager},
 * which binds the connection and runs the callbacks on completion.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
    private final ThreadLocal<TxState> state = new ThreadLocal<>();

    @Override
    public boolean isTransactionActive() {
        return state.get() != null;
    }

    @Override
    public Connection currentConnection() {
        return requireState().connection;
    }

    @Override
    public void afterCommit(Runnable callback) {
        requireState().afterCommit.add(callback);
    }

    @Override
    public void afterRollback(Runnable callback) {
        requireState().afterRollback.add(callback);
    }

    void bind(Connection connection) {
        if (state.get() != null) {
            throw new IllegalStateException("Transaction already active");
        }
        state.set(new TxState(connection));
    }

    void clearAfterCommit() {
        TxState current = state.get();
        if (current != null) {
            runAndClear(current.afterCommit);
        }
    }

    void clearAfterRollback() {
        TxState current = state.get();
        if (current != null) {
            runAndClear(current.afterRollback);
        }
    }

    private void runAndClear(List<Runnable> callbacks) {
        try {
            RuntimeException first = null;
            for (Runnable callback : callbacks) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    if (first == null) first = e;
                    else first.addSuppressed(e);
                }
            }
            if (first != null) throw first;
        } finally {
            state.remove();
        }
    }

    private TxState requireState() {
        TxState current = state.get();
        if (current == null) {
            throw new IllegalStateException("No active transaction");
        }
        return current;
    }

    private static final class TxState {
        private final Connection connection;
        private final List<Runnable> afterCommit = new ArrayList<>();
        private final List<Runnable> afterRollback = new ArrayList<>();

        private TxState(Connection connection) {
            this.connection = connection;
        }
    }
}
