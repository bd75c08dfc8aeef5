package io.rift;

import java.util.Objects;

/**
 * Thrown when an event type is part of the vocabulary but the rule table has no
 * reward configured for it.
 */
public final class RuleNotFoundException extends InvalidEventException {
    private final EventType eventType;

    public RuleNotFoundException(EventType eventType) {
        super("No reward rule configured for event type: "
                + Objects.requireNonNull(eventType, "eventType").wireName());
        this.eventType = eventType;
    }

    public EventType eventType() {
        return eventType;
    }
}
