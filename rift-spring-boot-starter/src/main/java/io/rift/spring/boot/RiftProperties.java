package io.rift.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for rift ingestion, stats and retention.
 *
 * @see RiftAutoConfiguration
 */
@ConfigurationProperties(prefix = "rift")
public class RiftProperties {

    /**
     * Trailing window in which an identical submission counts as a duplicate.
     */
    private Duration duplicateWindow = Duration.ofMinutes(5);

    private final Stats stats = new Stats();
    private final Rules rules = new Rules();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    public Duration getDuplicateWindow() {
        return duplicateWindow;
    }

    public void setDuplicateWindow(Duration duplicateWindow) {
        this.duplicateWindow = duplicateWindow;
    }

    public Stats getStats() {
        return stats;
    }

    public Rules getRules() {
        return rules;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum RuleSource {
        /** Read the {@code rules} table once at startup. */
        JDBC,
        /** Use {@code rift.rules.table.*} entries. */
        PROPERTIES
    }

    public static class Stats {
        /**
         * Zone that decides where "today" starts. Defaults to the JVM zone.
         */
        private ZoneId zone;

        /**
         * How long the server may serve cached stats. Zero disables caching.
         */
        private Duration cacheTtl = Duration.ZERO;

        public ZoneId getZone() {
            return zone;
        }

        public void setZone(ZoneId zone) {
            this.zone = zone;
        }

        public ZoneId resolvedZone() {
            return zone != null ? zone : ZoneId.systemDefault();
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    public static class Rules {
        private RuleSource source = RuleSource.JDBC;

        /**
         * Fail startup unless every event type has a rule.
         */
        private boolean strict = false;

        /**
         * Rules keyed by wire event type, used when {@code source=PROPERTIES}.
         */
        private Map<String, RuleEntry> table = new LinkedHashMap<>();

        public RuleSource getSource() {
            return source;
        }

        public void setSource(RuleSource source) {
            this.source = source;
        }

        public boolean isStrict() {
            return strict;
        }

        public void setStrict(boolean strict) {
            this.strict = strict;
        }

        public Map<String, RuleEntry> getTable() {
            return table;
        }

        public void setTable(Map<String, RuleEntry> table) {
            this.table = table;
        }
    }

    public static class RuleEntry {
        private int gold;
        private int xp;
        private String displayName;
        private String description;

        public int getGold() {
            return gold;
        }

        public void setGold(int gold) {
            this.gold = gold;
        }

        public int getXp() {
            return xp;
        }

        public void setXp(int xp) {
            this.xp = xp;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }

    public static class Purge {
        private boolean enabled = false;
        private Duration retention = Duration.ofDays(90);
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "rift";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
