package io.rift.spi;

import java.sql.Connection;

/**
 * Abstraction over the caller's transaction. Ingestion writes through the
 * connection exposed here so the event row and its audit entry commit or roll
 * back together with whatever else the caller does.
 */
public interface TxContext {

    /** Returns {@code true} if a transaction is active on the current thread. */
    boolean isTransactionActive();

    /**
     * Returns the connection bound to the active transaction.
     *
     * @throws IllegalStateException if no transaction is active
     */
    Connection currentConnection();

    /**
     * Registers a callback to run after the active transaction commits.
     *
     * @throws IllegalStateException if no transaction is active
     */
    void afterCommit(Runnable callback);

    /**
     * Registers a callback to run after the active transaction rolls back.
     *
     * @throws IllegalStateException if no transaction is active
     */
    void afterRollback(Runnable callback);
}
