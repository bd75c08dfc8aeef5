package io.rift.server.api;

import java.time.Instant;

/**
 * Body of every non-2xx response.
 */
public record ErrorResponse(String detail, String errorCode, Instant timestamp) {

    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String RULE_NOT_FOUND = "RULE_NOT_FOUND";
    public static final String POOL_EXHAUSTED = "POOL_EXHAUSTED";
    public static final String STORE_ERROR = "STORE_ERROR";
    public static final String RATE_LIMITED = "RATE_LIMITED";

    public static ErrorResponse of(String errorCode, String detail) {
        return new ErrorResponse(detail, errorCode, Instant.now());
    }
}
