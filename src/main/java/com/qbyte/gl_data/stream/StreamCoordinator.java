package com.qbyte.gl_data.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qbyte.gl_data.observability.CorrelationContext;
import com.qbyte.gl_data.observability.GlMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Creates independent stream sessions over the shared {@link RecordBuffer}.
 *
 * Sessions share nothing but the buffer. Any number may be attached at once,
 * each with its own cursor; ending one has no effect on the others or on the writer.
 */
@Service
@Slf4j
public class StreamCoordinator {

    private final RecordBuffer buffer;
    private final ObjectMapper objectMapper;
    private final GlMetrics metrics;
    private final Duration tickInterval;

    public StreamCoordinator(RecordBuffer buffer,
                             ObjectMapper objectMapper,
                             GlMetrics metrics,
                             @Value("${gl.stream.tick-interval-ms:${gl.generator.streaming-interval-ms:30000}}") long tickIntervalMs) {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("gl.stream.tick-interval-ms must be positive: " + tickIntervalMs);
        }
        this.buffer = buffer;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.tickInterval = Duration.ofMillis(tickIntervalMs);
    }

    /**
     * Opens a new session bound to the caller's correlation ID.
     * The snapshot is taken when the session starts running, not here.
     */
    public StreamSession openSession() {
        String sessionId = CorrelationContext.generateCorrelationId();
        log.debug("Opening stream session: sessionId={}", sessionId);
        return new StreamSession(sessionId, CorrelationContext.getCorrelationId(),
                buffer, objectMapper, metrics, tickInterval);
    }

    public Duration getTickInterval() {
        return tickInterval;
    }
}
