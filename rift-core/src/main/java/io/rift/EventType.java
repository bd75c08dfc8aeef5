package io.rift;

import java.util.Locale;

/**
 * Kind of sales activity. Each type is expected to have exactly one reward rule.
 */
public enum EventType {
    CALL_DIAL,
    CALL_CONNECT,
    EMAIL_SENT,
    MEETING_BOOKED,
    MEETING_ATTENDED;

    private final String wireName = name().toLowerCase(Locale.ROOT);

    /** Lowercase identifier used on the wire and in the store, e.g. {@code call_dial}. */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves an event type from its wire identifier. Matching is exact.
     *
     * @throws InvalidEventException if {@code value} is null or not a known event type
     */
    public static EventType fromWire(String value) {
        if (value != null) {
            for (EventType type : values()) {
                if (type.wireName.equals(value)) {
                    return type;
                }
            }
        }
        throw new InvalidEventException("Unknown event type: " + value);
    }
}
