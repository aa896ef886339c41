package com.qbyte.gl_data.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qbyte.gl_data.exception.StreamingException;
import com.qbyte.gl_data.ledger.GLRecord;
import com.qbyte.gl_data.observability.CorrelationContext;
import com.qbyte.gl_data.observability.GlMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;

/**
 * One consumer's view of the record stream: snapshot first, then a live tail.
 *
 * Protocol:
 * 1. Copy the whole buffer and write it as a single {@code buffered_records} frame
 * 2. Sleep one tick, read everything appended since the cursor, write one
 *    {@code new_record} frame per record, advance the cursor
 * 3. Repeat step 2 until the consumer disconnects or the thread is interrupted
 *
 * The cursor is private to the session. No buffer lock is held while sleeping
 * or writing, so a slow consumer never stalls the writer or other sessions.
 */
@Slf4j
public class StreamSession {

    private static final byte NEWLINE = '\n';

    private final String sessionId;
    private final String correlationId;
    private final RecordBuffer buffer;
    private final ObjectMapper objectMapper;
    private final GlMetrics metrics;
    private final Duration tickInterval;

    private volatile int cursor;

    StreamSession(String sessionId, String correlationId, RecordBuffer buffer,
                  ObjectMapper objectMapper, GlMetrics metrics, Duration tickInterval) {
        this.sessionId = sessionId;
        this.correlationId = correlationId;
        this.buffer = buffer;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.tickInterval = tickInterval;
    }

    /**
     * Runs the session on the calling thread until the consumer goes away.
     *
     * Returns normally when the thread is interrupted.
     *
     * @throws IOException when the consumer disconnects
     * @throws StreamingException when a frame cannot be encoded
     */
    public void run(OutputStream out) throws IOException {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        MDC.put(CorrelationContext.STREAM_SESSION_MDC_KEY, sessionId);
        int active = metrics.sessionStarted();
        String endReason = "interrupted";

        try {
            BufferSnapshot snapshot = buffer.snapshotAndTail();
            cursor = snapshot.getCursor();
            writeFrame(out, StreamFrame.buffered(snapshot.getRecords()));
            out.flush();
            metrics.recordFramesSent(StreamFrame.BUFFERED_RECORDS, 1);

            log.info("Stream session attached: snapshotRecords={}, activeSessions={}",
                    snapshot.getRecords().size(), active);

            while (sleepOneTick()) {
                BufferSnapshot update = buffer.readFrom(cursor);
                if (update.isEmpty()) {
                    continue;
                }
                for (GLRecord record : update.getRecords()) {
                    writeFrame(out, StreamFrame.newRecord(record));
                }
                out.flush();
                cursor = update.getCursor();
                metrics.recordFramesSent(StreamFrame.NEW_RECORD, update.getRecords().size());

                log.debug("Streamed new records: count={}, cursor={}", update.getRecords().size(), cursor);
            }

        } catch (StreamingException e) {
            endReason = "error";
            log.error("Stream session failed: cursor={}, error={}", cursor, e.getMessage(), e);
            throw e;
        } catch (IOException e) {
            endReason = "disconnected";
            log.debug("Stream consumer disconnected: cursor={}, error={}", cursor, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            endReason = "error";
            log.error("Stream session failed unexpectedly: cursor={}", cursor, e);
            throw e;
        } finally {
            int remaining = metrics.sessionEnded(endReason);
            log.info("Stream session ended: reason={}, cursor={}, activeSessions={}", endReason, cursor, remaining);
            MDC.remove(CorrelationContext.STREAM_SESSION_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Position in the buffer up to which records have been delivered.
     */
    public int getCursor() {
        return cursor;
    }

    private boolean sleepOneTick() {
        try {
            Thread.sleep(tickInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            // Restore the flag for the executor; the session ends normally
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void writeFrame(OutputStream out, Object frame) throws IOException {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(frame);
        } catch (JsonProcessingException e) {
            throw new StreamingException("Failed to encode stream frame", sessionId, e);
        }
        out.write(payload);
        out.write(NEWLINE);
    }
}
