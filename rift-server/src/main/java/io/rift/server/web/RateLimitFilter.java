package io.rift.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.rift.server.api.ErrorResponse;
import io.rift.server.config.RiftServerProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Token-bucket limit per client address and endpoint group. Buckets refill
 * their whole capacity once a minute and are dropped after two idle minutes,
 * by which time they would be full again.
 */
public class RateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final Duration IDLE_EXPIRY = Duration.ofMinutes(2);

    enum Group { WEBHOOK, STATS, HEALTH }

    private final Map<Group, Integer> limits;
    private final ObjectMapper mapper;
    private final Cache<String, Bucket> buckets;

    public RateLimitFilter(RiftServerProperties.RateLimit config, ObjectMapper mapper) {
        this(config, mapper, Ticker.systemTicker());
    }

    RateLimitFilter(RiftServerProperties.RateLimit config, ObjectMapper mapper, Ticker ticker) {
        this.limits = Map.of(
                Group.WEBHOOK, config.getPerMinute(),
                Group.STATS, config.getStatsPerMinute(),
                Group.HEALTH, config.getHealthPerMinute());
        this.mapper = mapper;
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(IDLE_EXPIRY)
                .ticker(ticker)
                .build();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        Group group = groupOf(request.getRequestURI());
        Bucket bucket = buckets.get(group + "|" + request.getRemoteAddr(),
                k -> newBucket(limits.get(group)));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            response.setHeader("X-Rate-Limit-Remaining", String.valueOf(probe.getRemainingTokens()));
            chain.doFilter(request, response);
            return;
        }
        long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()));
        log.warn("Rate limit exceeded for {} on {}", request.getRemoteAddr(), request.getRequestURI());
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        mapper.writeValue(response.getOutputStream(), ErrorResponse.of(ErrorResponse.RATE_LIMITED,
                "Rate limit of " + limits.get(group) + " requests per minute exceeded"));
    }

    long trackedClients() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    static Group groupOf(String uri) {
        if (uri.startsWith("/stats")) {
            return Group.STATS;
        }
        if (uri.startsWith("/health")) {
            return Group.HEALTH;
        }
        return Group.WEBHOOK;
    }

    private static Bucket newBucket(int perMinute) {
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.intervally(perMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
