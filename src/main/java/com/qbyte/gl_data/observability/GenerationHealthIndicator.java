package com.qbyte.gl_data.observability;

import com.qbyte.gl_data.engine.GenerationEngine;
import com.qbyte.gl_data.stream.RecordBuffer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Actuator health for the generation engine.
 * DOWN when the live phase has not produced a record for five streaming intervals.
 */
@Component("generationHealth")
public class GenerationHealthIndicator implements HealthIndicator {

    static final int STALL_INTERVALS = 5;

    private final GenerationEngine engine;
    private final RecordBuffer buffer;
    private final Clock clock;
    private final boolean liveEnabled;
    private final Duration interval;
    private final Instant startedAt;

    public GenerationHealthIndicator(GenerationEngine engine,
                                     RecordBuffer buffer,
                                     Clock clock,
                                     @Value("${gl.generator.live.enabled:true}") boolean liveEnabled,
                                     @Value("${gl.generator.streaming-interval-ms:30000}") long intervalMs) {
        this.engine = engine;
        this.buffer = buffer;
        this.clock = clock;
        this.liveEnabled = liveEnabled;
        this.interval = Duration.ofMillis(intervalMs);
        this.startedAt = clock.instant();
    }

    @Override
    public Health health() {
        if (!buffer.isSealed()) {
            return Health.down()
                    .withDetail("error", "Historical phase has not completed")
                    .build();
        }

        Health.Builder builder;
        Instant lastLive = engine.getLastLiveGeneratedAt();

        if (!liveEnabled) {
            builder = Health.up().withDetail("livePhase", "disabled");
        } else {
            Instant reference = lastLive != null ? lastLive : startedAt;
            Duration idle = Duration.between(reference, clock.instant());
            builder = idle.compareTo(interval.multipliedBy(STALL_INTERVALS)) > 0
                    ? Health.down().withDetail("error", "Live phase stalled")
                    : Health.up();
            builder.withDetail("idleMillis", idle.toMillis());
        }

        return builder
                .withDetail("historicalRecords", buffer.historicalCount())
                .withDetail("liveRecords", buffer.liveCount())
                .withDetail("lastEntryId", engine.getLastEntryId())
                .build();
    }
}
