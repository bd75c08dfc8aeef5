package io.rift.stats;

/**
 * Rank ladder keyed by the number of meetings booked. One tier per meeting,
 * capped at {@link #CHALLENGER}.
 */
public enum Rank {
    IRON("Iron"),
    BRONZE("Bronze"),
    SILVER("Silver"),
    GOLD("Gold"),
    PLATINUM("Platinum"),
    EMERALD("Emerald"),
    DIAMOND("Diamond"),
    MASTER("Master"),
    GRANDMASTER("Grandmaster"),
    CHALLENGER("Challenger");

    private static final Rank[] LADDER = values();

    private final String displayName;

    Rank(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @throws IllegalArgumentException if {@code meetingsBooked} is negative
     */
    public static Rank forMeetings(long meetingsBooked) {
        if (meetingsBooked < 0) {
            throw new IllegalArgumentException("meetingsBooked must be >= 0");
        }
        return LADDER[(int) Math.min(meetingsBooked, LADDER.length - 1)];
    }
}
