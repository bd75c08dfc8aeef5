package io.rift.server.api;

import java.time.Instant;

public record HealthResponse(String status, String database, Instant timestamp, String version) {

    public static HealthResponse healthy(String version) {
        return new HealthResponse("healthy", "connected", Instant.now(), version);
    }

    public static HealthResponse degraded(String version) {
        return new HealthResponse("degraded", "disconnected", Instant.now(), version);
    }
}
