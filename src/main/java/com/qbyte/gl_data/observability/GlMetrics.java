package com.qbyte.gl_data.observability;

import com.qbyte.gl_data.stream.RecordBuffer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for record generation and streaming.
 *
 * Metrics exposed:
 * - gl.records.generated: Counter of generated records, tagged by phase (historical, live)
 * - gl.buffer.size: Gauge of records currently buffered
 * - gl.stream.sessions.active: Gauge of attached stream consumers
 * - gl.stream.frames.sent: Counter of stream frames written, tagged by frame type
 * - gl.stream.sessions.ended: Counter of finished sessions, tagged by reason
 * - gl.queries: Counter of finite read queries, tagged by kind
 * - gl.queries.latency: Timer of finite read queries, tagged by kind
 */
@Component
@Slf4j
public class GlMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions = new AtomicInteger(0);

    public GlMetrics(MeterRegistry registry, RecordBuffer buffer) {
        this.registry = registry;

        Gauge.builder("gl.buffer.size", buffer, RecordBuffer::size)
                .description("Number of GL records currently buffered")
                .register(registry);

        Gauge.builder("gl.stream.sessions.active", activeSessions, AtomicInteger::get)
                .description("Number of attached stream consumers")
                .register(registry);

        log.info("GL metrics registered with Micrometer");
    }

    public void recordGenerated(String phase, long count) {
        registry.counter("gl.records.generated", "phase", phase).increment(count);
    }

    public void recordFramesSent(String frameType, long count) {
        registry.counter("gl.stream.frames.sent", "type", frameType).increment(count);
    }

    public int sessionStarted() {
        return activeSessions.incrementAndGet();
    }

    public int sessionEnded(String reason) {
        registry.counter("gl.stream.sessions.ended", "reason", reason).increment();
        return activeSessions.decrementAndGet();
    }

    public int getActiveSessions() {
        return activeSessions.get();
    }

    /**
     * Records a finite read query (range or batch) and its latency.
     */
    public void recordQuery(String kind, long durationMs) {
        registry.counter("gl.queries", "kind", kind).increment();
        registry.timer("gl.queries.latency", "kind", kind).record(Duration.ofMillis(durationMs));
    }
}
