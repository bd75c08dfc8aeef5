package io.rift;

/**
 * Unchecked exception wrapping persistence failures raised by an
 * {@link io.rift.spi.EventStore} or the stats read path.
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
