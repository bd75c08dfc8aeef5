package io.rift.spi;

import io.rift.EventType;
import io.rift.Reward;
import io.rift.Rule;
import io.rift.RuleNotFoundException;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only mapping from event type to reward rule.
 */
public interface RuleTable {

    /** Returns the rule for {@code eventType}, or empty if none is configured. */
    Optional<Rule> find(EventType eventType);

    /**
     * Resolves the reward for {@code eventType}.
     *
     * @throws RuleNotFoundException if no rule is configured
     */
    default Reward resolve(EventType eventType) {
        return find(eventType)
                .map(Rule::reward)
                .orElseThrow(() -> new RuleNotFoundException(eventType));
    }

    /** Event types in the vocabulary that have no rule. */
    default Set<EventType> missingTypes() {
        Set<EventType> missing = EnumSet.noneOf(EventType.class);
        for (EventType type : EventType.values()) {
            if (find(type).isEmpty()) {
                missing.add(type);
            }
        }
        return missing;
    }
}
