package io.rift.server.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.rift.spring.boot.RiftProperties;
import io.rift.stats.DailyStats;
import io.rift.stats.DerivedStats;
import io.rift.stats.StatsAggregator;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Read-through cache in front of {@link StatsAggregator}. With a zero TTL every
 * call goes to the store. Admitted events clear the cache once they commit.
 */
@Service
public class StatsService {
    private static final String CURRENT = "current";

    private final StatsAggregator aggregator;
    private final Cache<String, DerivedStats> current;
    private final Cache<Integer, List<DailyStats>> daily;

    public StatsService(StatsAggregator aggregator, RiftProperties props) {
        this.aggregator = aggregator;
        Duration ttl = props.getStats().getCacheTtl();
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            this.current = Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(1).build();
            this.daily = Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(StatsAggregator.MAX_DAYS).build();
        } else {
            this.current = null;
            this.daily = null;
        }
    }

    public DerivedStats current() {
        if (current == null) {
            return aggregator.currentStats();
        }
        return current.get(CURRENT, k -> aggregator.currentStats());
    }

    public List<DailyStats> daily(int days) {
        if (daily == null) {
            return aggregator.dailyStats(days);
        }
        return daily.get(days, aggregator::dailyStats);
    }

    public void invalidate() {
        if (current != null) {
            current.invalidateAll();
            daily.invalidateAll();
        }
    }
}
