package io.rift.rules;

import io.rift.EventType;
import io.rift.Reward;
import io.rift.Rule;
import io.rift.spi.RuleTable;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable in-memory {@link RuleTable}.
 *
 * <p>Built either from configuration or from a snapshot of the {@code rules}
 * table. Each event type may appear at most once.
 */
public final class StaticRuleTable implements RuleTable {
    private final Map<EventType, Rule> rules;

    private StaticRuleTable(Map<EventType, Rule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    /**
     * Creates a table from the given rules.
     *
     * @throws IllegalArgumentException if two rules share an event type
     */
    public static StaticRuleTable of(Collection<Rule> rules) {
        Objects.requireNonNull(rules, "rules");
        Map<EventType, Rule> byType = new EnumMap<>(EventType.class);
        for (Rule rule : rules) {
            Objects.requireNonNull(rule, "rule");
            if (byType.putIfAbsent(rule.eventType(), rule) != null) {
                throw new IllegalArgumentException(
                        "Duplicate rule for event type: " + rule.eventType().wireName());
            }
        }
        return new StaticRuleTable(byType);
    }

    public static StaticRuleTable of(Rule... rules) {
        return of(List.of(rules));
    }

    /**
     * The stock reward schedule: dial 10/5, connect 25/15, email 10/3,
     * meeting booked 200/100, meeting attended 500/200 (gold/xp).
     */
    public static StaticRuleTable defaults() {
        return of(
                new Rule(EventType.CALL_DIAL, new Reward(10, 5),
                        "Dial Attempt", "Outbound call attempt"),
                new Rule(EventType.CALL_CONNECT, new Reward(25, 15),
                        "Call Connected", "Call answered by prospect"),
                new Rule(EventType.EMAIL_SENT, new Reward(10, 3),
                        "Email Sent", "Outbound email sent"),
                new Rule(EventType.MEETING_BOOKED, new Reward(200, 100),
                        "Meeting Booked", "Meeting scheduled with prospect"),
                new Rule(EventType.MEETING_ATTENDED, new Reward(500, 200),
                        "Meeting Attended", "Meeting held with prospect"));
    }

    @Override
    public Optional<Rule> find(EventType eventType) {
        return Optional.ofNullable(rules.get(eventType));
    }

    /** All configured rules, ordered by event type. */
    public Collection<Rule> rules() {
        return rules.values();
    }

    /**
     * Fails if any event type in the vocabulary has no rule.
     *
     * @return this table
     * @throws IllegalStateException naming the missing event types
     */
    public StaticRuleTable requireComplete() {
        Set<EventType> missing = missingTypes();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No reward rule configured for event types: "
                    + missing.stream().map(EventType::wireName).collect(Collectors.joining(", ")));
        }
        return this;
    }

    @Override
    public String toString() {
        return "StaticRuleTable" + rules.values();
    }
}
