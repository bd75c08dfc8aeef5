package io.rift;

/**
 * Gold and XP granted for one admitted event. Both values are non-negative.
 *
 * @param gold gold value
 * @param xp   experience value
 */
public record Reward(int gold, int xp) {
    public static final Reward NONE = new Reward(0, 0);

    public Reward {
        if (gold < 0) {
            throw new IllegalArgumentException("gold must be >= 0");
        }
        if (xp < 0) {
            throw new IllegalArgumentException("xp must be >= 0");
        }
    }
}
