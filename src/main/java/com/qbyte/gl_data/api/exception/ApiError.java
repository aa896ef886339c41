package com.qbyte.gl_data.api.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body for every non-2xx JSON response.
 * {@code details} echoes the offending query parameters and their raw values.
 */
@Value
@Builder
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;

    public static ApiError of(String error, String message, Map<String, String> details) {
        return ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
    }
}
