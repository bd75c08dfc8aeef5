package io.rift;

import java.util.Locale;

/**
 * Originating system of an activity event.
 */
public enum Source {
    OUTREACH,
    NOOKS,
    MANUAL,
    ZAPIER;

    private final String wireName = name().toLowerCase(Locale.ROOT);

    /** Lowercase identifier used on the wire and in the store. */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a source from its wire identifier. Matching is exact: no case
     * folding, no trimming.
     *
     * @throws InvalidEventException if {@code value} is null or not a known source
     */
    public static Source fromWire(String value) {
        if (value != null) {
            for (Source source : values()) {
                if (source.wireName.equals(value)) {
                    return source;
                }
            }
        }
        throw new InvalidEventException("Unknown source: " + value);
    }
}
