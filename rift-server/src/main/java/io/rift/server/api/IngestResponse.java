package io.rift.server.api;

import io.rift.IngestResult;

public record IngestResponse(
        String status,
        String eventId,
        int goldEarned,
        int xpEarned,
        String message,
        boolean duplicate) {

    static final String PROCESSED = "Event processed successfully";
    static final String DUPLICATE = "Duplicate event ignored (idempotency check)";

    public static IngestResponse from(IngestResult result) {
        if (result.isDuplicate()) {
            return new IngestResponse("success", "duplicate", 0, 0, DUPLICATE, true);
        }
        return new IngestResponse("success", result.eventId(),
                result.reward().gold(), result.reward().xp(), PROCESSED, false);
    }
}
