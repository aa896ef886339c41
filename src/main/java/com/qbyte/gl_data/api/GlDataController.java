package com.qbyte.gl_data.api;

import com.qbyte.gl_data.api.dto.BatchResponse;
import com.qbyte.gl_data.api.dto.RangeResponse;
import com.qbyte.gl_data.exception.InvalidRangeException;
import com.qbyte.gl_data.ledger.GLRecord;
import com.qbyte.gl_data.stream.RecordQueryService;
import com.qbyte.gl_data.stream.StreamCoordinator;
import com.qbyte.gl_data.stream.StreamSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST surface for GL records.
 *
 * GET /get-gl
 * - no date parameters: newline-delimited JSON stream, snapshot frame then live frames
 * - start_date and end_date: JSON body with historical records in the inclusive range
 *
 * GET /get-gl-batch
 * - finite pulls for the ingestion pipeline, by entry ID watermark or half-open date window
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class GlDataController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");
    static final int DEFAULT_BATCH_LIMIT = 1000;
    static final int MAX_BATCH_LIMIT = 10_000;

    private final StreamCoordinator streamCoordinator;
    private final RecordQueryService queryService;

    /**
     * Historical records in an inclusive date range. Also catches a lone
     * start_date or end_date so it can be rejected.
     */
    @GetMapping("/get-gl")
    public ResponseEntity<RangeResponse> getGlRange(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate) {

        DateRange range = DateRange.parse(startDate, endDate)
                .orElseThrow(() -> new InvalidRangeException(
                        "Both start_date and end_date must be provided together", Map.of()));

        List<GLRecord> records = queryService.historicalRange(range.getStart(), range.getEnd());
        return ResponseEntity.ok(RangeResponse.of(range.getStart(), range.getEnd(), records));
    }

    @GetMapping(value = "/get-gl", params = {"!start_date", "!end_date"})
    public ResponseEntity<StreamingResponseBody> streamGl() {
        StreamSession session = streamCoordinator.openSession();
        log.info("Stream requested: sessionId={}", session.getSessionId());

        StreamingResponseBody body = session::run;
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(body);
    }

    /**
     * Batch read for the ingestion pipeline.
     *
     * @param limit maximum records returned, 1 to 10,000
     * @param afterId return records with gl_entry_id above this watermark
     * @param startDate window start, inclusive
     * @param endDate window end, exclusive
     */
    @GetMapping("/get-gl-batch")
    public ResponseEntity<BatchResponse> getGlBatch(
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "after_id", required = false) Long afterId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate) {

        int effectiveLimit = validateLimit(limit);
        Optional<DateRange> window = DateRange.parse(startDate, endDate);

        if (afterId != null && window.isPresent()) {
            throw new InvalidRangeException("after_id cannot be combined with start_date/end_date",
                    Map.of("after_id", afterId.toString(),
                           "start_date", startDate,
                           "end_date", endDate));
        }
        if (afterId != null && afterId < 0) {
            throw InvalidRangeException.forField("after_id must not be negative", "after_id", afterId.toString());
        }

        BatchResponse.BatchResponseBuilder response = BatchResponse.builder().limit(effectiveLimit);
        List<GLRecord> records;

        if (afterId != null) {
            records = queryService.recordsAfter(afterId, effectiveLimit);
            response.afterId(afterId);
        } else if (window.isPresent()) {
            DateRange w = window.get();
            records = queryService.recordsInWindow(w.getStart(), w.getEnd(), effectiveLimit);
            response.startDate(w.getStart()).endDate(w.getEnd());
        } else {
            records = queryService.firstRecords(effectiveLimit);
        }

        if (!records.isEmpty()) {
            response.lastEntryId(records.get(records.size() - 1).getGlEntryId());
        }

        return ResponseEntity.ok(response.count(records.size()).data(records).build());
    }

    private int validateLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_BATCH_LIMIT;
        }
        if (limit < 1 || limit > MAX_BATCH_LIMIT) {
            throw InvalidRangeException.forField(
                    "limit must be between 1 and " + MAX_BATCH_LIMIT, "limit", limit.toString());
        }
        return limit;
    }
}
