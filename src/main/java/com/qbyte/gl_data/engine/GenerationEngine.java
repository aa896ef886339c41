package com.qbyte.gl_data.engine;

import com.qbyte.gl_data.generator.LedgerRandom;
import com.qbyte.gl_data.ledger.GLRecord;
import com.qbyte.gl_data.ledger.RecordSynthesizer;
import com.qbyte.gl_data.observability.GlMetrics;
import com.qbyte.gl_data.stream.RecordBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Drives record generation against the single seeded random source.
 *
 * Historical phase: runs once during construction, before any consumer can
 * attach. Generates one record per day for {@code historicalDays} days ending
 * the day before the fixed start date, each stamped at midnight, then seals
 * the buffer's historical portion.
 *
 * Live phase: each {@link #generateNext()} call produces one record whose
 * simulated timestamp starts at the fixed start date's midnight and advances
 * by one second per call. How often it is called (the wall-clock tick) is
 * configured separately and has no effect on record content.
 *
 * Entry IDs continue across both phases without reset.
 */
@Service
@Slf4j
public class GenerationEngine {

    private final RecordSynthesizer synthesizer;
    private final RecordBuffer buffer;
    private final GlMetrics metrics;
    private final Clock clock;

    private final LedgerRandom random;
    private final LocalDate fixedStartDate;
    private final int historicalDays;

    private long lastEntryId;
    private LocalDateTime nextLiveTimestamp;
    private volatile Instant lastLiveGeneratedAt;

    public GenerationEngine(RecordSynthesizer synthesizer,
                            RecordBuffer buffer,
                            GlMetrics metrics,
                            Clock clock,
                            @Value("${gl.generator.seed:42}") long seed,
                            @Value("${gl.generator.fixed-start-date:2025-11-10}") String fixedStartDate,
                            @Value("${gl.generator.historical-days:365}") int historicalDays) {
        if (historicalDays < 0) {
            throw new IllegalArgumentException("gl.generator.historical-days must not be negative: " + historicalDays);
        }
        this.synthesizer = synthesizer;
        this.buffer = buffer;
        this.metrics = metrics;
        this.clock = clock;
        this.random = new LedgerRandom(seed);
        this.fixedStartDate = LocalDate.parse(fixedStartDate.trim());
        this.historicalDays = historicalDays;
        this.nextLiveTimestamp = this.fixedStartDate.atStartOfDay();

        log.info("Starting historical phase: seed={}, fixedStartDate={}, historicalDays={}",
                seed, this.fixedStartDate, historicalDays);
        generateHistorical();
    }

    private void generateHistorical() {
        long startTime = System.currentTimeMillis();
        LocalDate day = fixedStartDate.minusDays(historicalDays);

        for (int i = 0; i < historicalDays; i++) {
            GLRecord record = synthesizer.synthesize(random, lastEntryId + 1, day, day.atStartOfDay());
            lastEntryId = record.getGlEntryId();
            buffer.append(record);
            day = day.plusDays(1);
        }
        buffer.sealHistorical();
        metrics.recordGenerated("historical", historicalDays);

        log.info("Historical phase complete: records={}, lastEntryId={}, duration={}ms",
                historicalDays, lastEntryId, System.currentTimeMillis() - startTime);
    }

    /**
     * Generates and appends the next live record.
     * Synthesis happens before the buffer lock is taken; only the append is locked.
     */
    public synchronized GLRecord generateNext() {
        LocalDateTime timestamp = nextLiveTimestamp;
        GLRecord record = synthesizer.synthesize(random, lastEntryId + 1, timestamp.toLocalDate(), timestamp);

        buffer.append(record);
        lastEntryId = record.getGlEntryId();
        nextLiveTimestamp = timestamp.plusSeconds(1);
        lastLiveGeneratedAt = clock.instant();
        metrics.recordGenerated("live", 1);

        log.debug("Generated live record: entryId={}, batch={}, timestamp={}",
                record.getGlEntryId(), record.getJournalBatch(), timestamp);
        return record;
    }

    public LocalDate getFixedStartDate() {
        return fixedStartDate;
    }

    public int getHistoricalDays() {
        return historicalDays;
    }

    public synchronized long getLastEntryId() {
        return lastEntryId;
    }

    /**
     * Wall-clock instant of the last live record, or null before the first tick.
     */
    public Instant getLastLiveGeneratedAt() {
        return lastLiveGeneratedAt;
    }
}
