package io.rift;

/**
 * Thrown when an incoming event fails validation: an unknown source or event
 * type, malformed metadata, or metadata exceeding the size limit.
 *
 * <p>Rejections happen before any store interaction, so nothing has been
 * written when this is thrown.
 */
public class InvalidEventException extends RuntimeException {
    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
