package io.rift.stats;

/**
 * Level derived from cumulative XP. Every level is {@value #LEVEL_WIDTH} XP wide
 * and levels start at 1.
 *
 * @param level        current level, at least 1
 * @param xpInLevel    XP earned inside the current level
 * @param xpToNext     XP still missing to reach the next level, in {@code 1..LEVEL_WIDTH}
 */
public record LevelProgression(long level, long xpInLevel, long xpToNext) {
    public static final long LEVEL_WIDTH = 1000;

    /**
     * @throws IllegalArgumentException if {@code totalXp} is negative
     */
    public static LevelProgression fromTotalXp(long totalXp) {
        if (totalXp < 0) {
            throw new IllegalArgumentException("totalXp must be >= 0");
        }
        long inLevel = totalXp % LEVEL_WIDTH;
        return new LevelProgression(totalXp / LEVEL_WIDTH + 1, inLevel, LEVEL_WIDTH - inLevel);
    }
}
