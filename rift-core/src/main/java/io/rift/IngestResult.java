package io.rift;

import java.util.Objects;

/**
 * Outcome of one ingestion call.
 *
 * <p>An admitted event carries its store-assigned id and the reward it earned.
 * A duplicate carries no id and a zero reward; it is a success for the caller,
 * not an error.
 */
public final class IngestResult {
    private static final IngestResult DUPLICATE = new IngestResult(null, Reward.NONE, true);

    private final String eventId;
    private final Reward reward;
    private final boolean duplicate;

    private IngestResult(String eventId, Reward reward, boolean duplicate) {
        this.eventId = eventId;
        this.reward = reward;
        this.duplicate = duplicate;
    }

    public static IngestResult admitted(String eventId, Reward reward) {
        return new IngestResult(Objects.requireNonNull(eventId, "eventId"),
                Objects.requireNonNull(reward, "reward"), false);
    }

    public static IngestResult duplicate() {
        return DUPLICATE;
    }

    /** Store-assigned id, or {@code null} for a duplicate. */
    public String eventId() {
        return eventId;
    }

    public Reward reward() {
        return reward;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    @Override
    public String toString() {
        return duplicate
                ? "IngestResult[duplicate]"
                : "IngestResult[eventId=" + eventId + ", reward=" + reward + "]";
    }
}
