package com.qbyte.gl_data.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qbyte.gl_data.GlTestFixtures;
import com.qbyte.gl_data.engine.GenerationEngine;
import com.qbyte.gl_data.exception.StreamingException;
import com.qbyte.gl_data.observability.GlMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Sessions run on plain threads writing to in-memory sinks; interrupting the
 * thread ends a session the same way executor shutdown does.
 */
class StreamSessionTest {

    private static final long TICK_MS = 10;

    private final ObjectMapper mapper = GlTestFixtures.objectMapper();
    private final List<Thread> threads = new ArrayList<>();

    private SimpleMeterRegistry registry;
    private RecordBuffer buffer;
    private GlMetrics metrics;
    private GenerationEngine engine;
    private StreamCoordinator coordinator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        buffer = new RecordBuffer();
        metrics = new GlMetrics(registry, buffer);
        engine = GlTestFixtures.engine(42, "2025-11-10", 5, buffer, metrics);
        coordinator = new StreamCoordinator(buffer, mapper, metrics, TICK_MS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Thread thread : threads) {
            thread.interrupt();
            thread.join(2000);
        }
    }

    @Test
    @DisplayName("Each session gets its own snapshot, then every later record exactly once, in order")
    void testIndependentSessions() throws Exception {
        ByteArrayOutputStream outA = new ByteArrayOutputStream();
        StreamSession sessionA = coordinator.openSession();
        Thread threadA = start(sessionA, outA);
        GlTestFixtures.await("session A snapshot", 2000, () -> lines(outA).size() >= 1);

        for (int i = 0; i < 10; i++) {
            engine.generateNext();
        }

        ByteArrayOutputStream outB = new ByteArrayOutputStream();
        StreamSession sessionB = coordinator.openSession();
        Thread threadB = start(sessionB, outB);
        GlTestFixtures.await("session B snapshot", 2000, () -> lines(outB).size() >= 1);

        for (int i = 0; i < 5; i++) {
            engine.generateNext();
        }

        GlTestFixtures.await("both sessions caught up", 5000,
                () -> sessionA.getCursor() == 20 && sessionB.getCursor() == 20);
        stop(threadA);
        stop(threadB);

        List<JsonNode> framesA = parse(outA);
        assertBuffered(framesA.get(0), 5);
        assertEquals(range(6, 20), newRecordIds(framesA));

        List<JsonNode> framesB = parse(outB);
        assertBuffered(framesB.get(0), 15);
        assertEquals(range(16, 20), newRecordIds(framesB));

        assertNotEquals(sessionA.getSessionId(), sessionB.getSessionId());
        assertEquals(0, metrics.getActiveSessions());
    }

    @Test
    @DisplayName("Snapshot frame carries records in entry order with the wire field names")
    void testSnapshotFrameShape() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Thread thread = start(coordinator.openSession(), out);
        GlTestFixtures.await("snapshot", 2000, () -> lines(out).size() >= 1);
        stop(thread);

        JsonNode frame = parse(out).get(0);
        assertEquals(3, frame.size());
        assertEquals(StreamFrame.BUFFERED_RECORDS, frame.get("type").asText());
        assertEquals(5, frame.get("count").asInt());
        assertEquals(1, frame.get("data").get(0).get("gl_entry_id").asLong());
        assertEquals("2025-11-05", frame.get("data").get(0).get("transaction_date").asText());
        assertEquals(5, frame.get("data").get(4).get("gl_entry_id").asLong());
    }

    @Test
    @DisplayName("A consumer that disconnects ends only its own session")
    void testDisconnect() throws Exception {
        ByteArrayOutputStream healthyOut = new ByteArrayOutputStream();
        StreamSession healthy = coordinator.openSession();
        Thread healthyThread = start(healthy, healthyOut);
        GlTestFixtures.await("healthy snapshot", 2000, () -> lines(healthyOut).size() >= 1);

        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                throw new IOException("Broken pipe");
            }
        };
        StreamSession doomed = coordinator.openSession();
        assertThrows(IOException.class, () -> doomed.run(broken));
        assertEquals(1, metrics.getActiveSessions());
        assertEquals(1.0, registry.counter("gl.stream.sessions.ended", "reason", "disconnected").count());

        engine.generateNext();
        GlTestFixtures.await("healthy session continues", 2000, () -> healthy.getCursor() == 6);
        stop(healthyThread);

        assertEquals(List.of(6L), newRecordIds(parse(healthyOut)));
        assertEquals(0, metrics.getActiveSessions());
        assertEquals(1.0, registry.counter("gl.stream.sessions.ended", "reason", "interrupted").count());
    }

    @Test
    @DisplayName("An unencodable frame ends the session with a StreamingException")
    void testEncodingFailure() throws Exception {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsBytes(any())).thenThrow(new JsonProcessingException("boom") { });
        StreamCoordinator failingCoordinator = new StreamCoordinator(buffer, failing, metrics, TICK_MS);
        StreamSession session = failingCoordinator.openSession();

        StreamingException e = assertThrows(StreamingException.class,
                () -> session.run(new ByteArrayOutputStream()));
        assertEquals(session.getSessionId(), e.getDetails().get("sessionId"));
        assertEquals(0, metrics.getActiveSessions());
        assertEquals(1.0, registry.counter("gl.stream.sessions.ended", "reason", "error").count());
    }

    @Test
    @DisplayName("An unexpected runtime failure is counted as an error, not an interruption")
    void testUnexpectedFailureCountedAsError() throws Exception {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsBytes(any())).thenThrow(new IllegalStateException("serializer misconfigured"));
        StreamSession session = new StreamCoordinator(buffer, failing, metrics, TICK_MS).openSession();

        assertThrows(IllegalStateException.class, () -> session.run(new ByteArrayOutputStream()));
        assertEquals(0, metrics.getActiveSessions());
        assertEquals(1.0, registry.counter("gl.stream.sessions.ended", "reason", "error").count());
        assertEquals(0.0, registry.counter("gl.stream.sessions.ended", "reason", "interrupted").count());
    }

    @Test
    @DisplayName("Session IDs use the same short form as correlation IDs")
    void testSessionIdFormat() {
        String sessionId = coordinator.openSession().getSessionId();
        assertTrue(sessionId.matches("[0-9a-f]{8}"), sessionId);
    }

    @Test
    @DisplayName("Tick interval must be positive")
    void testTickIntervalValidation() {
        assertThrows(IllegalArgumentException.class, () -> new StreamCoordinator(buffer, mapper, metrics, 0));
        assertEquals(TICK_MS, coordinator.getTickInterval().toMillis());
    }

    private Thread start(StreamSession session, OutputStream out) {
        Thread thread = new Thread(() -> {
            try {
                session.run(out);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }, "test-stream-" + session.getSessionId());
        threads.add(thread);
        thread.start();
        return thread;
    }

    private static void stop(Thread thread) throws InterruptedException {
        thread.interrupt();
        thread.join(2000);
        assertFalse(thread.isAlive());
    }

    private static List<String> lines(ByteArrayOutputStream out) {
        String text = out.toString(StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = text.indexOf('\n', start)) >= 0) {
            lines.add(text.substring(start, newline));
            start = newline + 1;
        }
        return lines;
    }

    private List<JsonNode> parse(ByteArrayOutputStream out) throws IOException {
        List<JsonNode> frames = new ArrayList<>();
        for (String line : lines(out)) {
            frames.add(mapper.readTree(line));
        }
        return frames;
    }

    private static void assertBuffered(JsonNode frame, int count) {
        assertEquals(StreamFrame.BUFFERED_RECORDS, frame.get("type").asText());
        assertEquals(count, frame.get("count").asInt());
        assertEquals(count, frame.get("data").size());
    }

    private static List<Long> newRecordIds(List<JsonNode> frames) {
        List<Long> ids = new ArrayList<>();
        for (JsonNode frame : frames.subList(1, frames.size())) {
            assertEquals(StreamFrame.NEW_RECORD, frame.get("type").asText());
            assertEquals(2, frame.size());
            ids.add(frame.get("data").get("gl_entry_id").asLong());
        }
        return ids;
    }

    private static List<Long> range(long from, long to) {
        List<Long> ids = new ArrayList<>();
        for (long id = from; id <= to; id++) {
            ids.add(id);
        }
        return ids;
    }
}
