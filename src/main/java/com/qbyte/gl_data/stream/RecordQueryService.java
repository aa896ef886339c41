package com.qbyte.gl_data.stream;

import com.qbyte.gl_data.ledger.GLRecord;
import com.qbyte.gl_data.observability.GlMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Finite, cursor-free reads over the buffer.
 *
 * - {@link #historicalRange}: inclusive date range over the historical portion (the range query)
 * - {@link #recordsAfter}, {@link #recordsInWindow}, {@link #firstRecords}: bulk pulls for the
 *   ingestion pipeline, covering historical and live records
 *
 * Callers validate their parameters; this service assumes {@code start <= end} and a positive limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordQueryService {

    private final RecordBuffer buffer;
    private final GlMetrics metrics;

    public List<GLRecord> historicalRange(LocalDate start, LocalDate end) {
        long startTime = System.currentTimeMillis();
        List<GLRecord> records = buffer.range(start, end);
        metrics.recordQuery("range", System.currentTimeMillis() - startTime);

        log.info("Historical range query: start={}, end={}, count={}", start, end, records.size());
        return records;
    }

    public List<GLRecord> recordsAfter(long watermark, int limit) {
        long startTime = System.currentTimeMillis();
        List<GLRecord> records = buffer.recordsAfter(watermark, limit);
        metrics.recordQuery("watermark", System.currentTimeMillis() - startTime);

        log.info("Watermark batch query: afterId={}, limit={}, count={}", watermark, limit, records.size());
        return records;
    }

    /**
     * Records with {@code from <= transaction_date < to}.
     */
    public List<GLRecord> recordsInWindow(LocalDate from, LocalDate to, int limit) {
        long startTime = System.currentTimeMillis();
        List<GLRecord> records = buffer.recordsInWindow(from, to, limit);
        metrics.recordQuery("window", System.currentTimeMillis() - startTime);

        log.info("Window batch query: from={}, to={}, limit={}, count={}", from, to, limit, records.size());
        return records;
    }

    public List<GLRecord> firstRecords(int limit) {
        long startTime = System.currentTimeMillis();
        List<GLRecord> records = buffer.buffered(limit);
        metrics.recordQuery("head", System.currentTimeMillis() - startTime);

        log.info("Buffered batch query: limit={}, count={}", limit, records.size());
        return records;
    }
}
