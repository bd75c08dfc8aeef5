package io.rift;

import java.util.Objects;

/**
 * Reward rule for one event type.
 *
 * @param eventType   the event type this rule applies to
 * @param reward      gold and XP granted per admitted event
 * @param displayName human-readable label, may be null
 * @param description free-form description, may be null
 */
public record Rule(EventType eventType, Reward reward, String displayName, String description) {
    public Rule {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(reward, "reward");
    }

    public static Rule of(EventType eventType, int gold, int xp) {
        return new Rule(eventType, new Reward(gold, xp), null, null);
    }
}
