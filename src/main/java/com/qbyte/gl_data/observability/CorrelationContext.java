package com.qbyte.gl_data.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID for request tracing.
 *
 * The correlation ID is taken from the X-Correlation-ID header or generated,
 * copied into MDC for every log statement on the request thread, and copied
 * again onto the streaming thread when a stream session starts.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String STREAM_SESSION_MDC_KEY = "streamSessionId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Eight hex characters; short enough to scan in log lines.
     * Also used for stream session IDs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
