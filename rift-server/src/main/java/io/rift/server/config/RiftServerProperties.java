package io.rift.server.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * HTTP-facing settings. Startup fails if the webhook secret is missing or short.
 */
@Validated
@ConfigurationProperties(prefix = "rift.server")
public class RiftServerProperties {

    /**
     * Shared secret expected in the {@code X-RIFT-SECRET} header.
     */
    @NotBlank
    @Size(min = 32, message = "must be at least 32 characters")
    private String webhookSecret;

    /**
     * Version reported by the health endpoint.
     */
    private String version = "0.1.0";

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    /** Requests per client address per minute, by endpoint group. */
    public static class RateLimit {
        @Min(1)
        private int perMinute = 60;
        @Min(1)
        private int statsPerMinute = 120;
        @Min(1)
        private int healthPerMinute = 100;

        public int getPerMinute() {
            return perMinute;
        }

        public void setPerMinute(int perMinute) {
            this.perMinute = perMinute;
        }

        public int getStatsPerMinute() {
            return statsPerMinute;
        }

        public void setStatsPerMinute(int statsPerMinute) {
            this.statsPerMinute = statsPerMinute;
        }

        public int getHealthPerMinute() {
            return healthPerMinute;
        }

        public void setHealthPerMinute(int healthPerMinute) {
            this.healthPerMinute = healthPerMinute;
        }
    }
}
