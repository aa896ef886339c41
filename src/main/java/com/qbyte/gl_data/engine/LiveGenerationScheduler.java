package com.qbyte.gl_data.engine;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background task for the live phase.
 *
 * Fires once per streaming interval (gl.generator.streaming-interval-ms),
 * first after one full interval, and appends one record per tick.
 * Disabled with gl.generator.live.enabled=false, in which case nothing
 * calls {@link GenerationEngine#generateNext()} except tests.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "gl.generator.live.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class LiveGenerationScheduler {

    private final GenerationEngine engine;

    @Scheduled(
        fixedRateString = "${gl.generator.streaming-interval-ms:30000}",
        initialDelayString = "${gl.generator.streaming-interval-ms:30000}")
    public void tick() {
        engine.generateNext();
    }
}
