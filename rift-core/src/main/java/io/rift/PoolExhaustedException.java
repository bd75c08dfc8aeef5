package io.rift;

/**
 * Thrown when no pooled connection became available within the configured
 * acquisition timeout. Callers should treat it as retryable.
 */
public final class PoolExhaustedException extends EventStoreException {
    public PoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
