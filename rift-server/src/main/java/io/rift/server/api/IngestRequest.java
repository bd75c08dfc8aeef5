package io.rift.server.api;

import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.Map;

/**
 * Webhook body. {@code source} and {@code event_type} are checked against the
 * vocabulary when the request is converted to an {@link io.rift.IncomingEvent}.
 *
 * @param timestamp sender's clock, stored for reference only
 */
public record IngestRequest(
        @NotBlank String source,
        @NotBlank String eventType,
        Map<String, Object> metadata,
        Instant timestamp) {
}
