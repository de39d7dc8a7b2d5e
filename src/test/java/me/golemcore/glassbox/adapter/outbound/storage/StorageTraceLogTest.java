package me.golemcore.glassbox.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.glassbox.domain.model.TraceEvent;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageTraceLogTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private Clock clock;
    private StorageTraceLog traceLog;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        traceLog = new StorageTraceLog(storage, objectMapper, clock);
    }

    @Test
    void shouldAssignIdSequenceAndTimestamp() {
        TraceEvent stored = traceLog.append(event("exec-1", TraceEventType.EXECUTION_START));

        assertNotNull(stored.getId());
        assertEquals(1, stored.getSequenceNumber());
        assertEquals(NOW, stored.getTimestamp());
    }

    @Test
    void shouldNumberEachExecutionIndependently() {
        traceLog.append(event("exec-1", TraceEventType.EXECUTION_START));
        traceLog.append(event("exec-1", TraceEventType.LLM_CALL));
        TraceEvent other = traceLog.append(event("exec-2", TraceEventType.EXECUTION_START));

        assertEquals(1, other.getSequenceNumber());
        assertEquals(List.of(1L, 2L), sequences("exec-1"));
    }

    @Test
    void shouldReadBackPayloadAndColumns() {
        traceLog.append(TraceEvent.builder()
                .executionId("exec-1")
                .type(TraceEventType.LLM_CALL)
                .payload(Map.of("model", "openai/gpt-4o"))
                .durationMs(120L)
                .model("openai/gpt-4o")
                .tokensIn(10)
                .tokensOut(5)
                .build());

        TraceEvent loaded = traceLog.list("exec-1").get(0);

        assertEquals(TraceEventType.LLM_CALL, loaded.getType());
        assertEquals("openai/gpt-4o", loaded.getPayload().get("model"));
        assertEquals(120L, loaded.getDurationMs());
        assertEquals(10, loaded.getTokensIn());
    }

    @Test
    void shouldContinueNumberingAfterRestart() {
        traceLog.append(event("exec-1", TraceEventType.EXECUTION_START));
        traceLog.append(event("exec-1", TraceEventType.LLM_CALL));

        StorageTraceLog restarted = new StorageTraceLog(storage, objectMapper, clock);
        TraceEvent next = restarted.append(event("exec-1", TraceEventType.TOOL_CALL));

        assertEquals(3, next.getSequenceNumber());
    }

    @Test
    void shouldForgetCountersOnReleaseAndKeepNumbering() {
        for (int i = 0; i < 20; i++) {
            String executionId = "exec-" + i;
            traceLog.append(event(executionId, TraceEventType.EXECUTION_START));
            traceLog.append(event(executionId, TraceEventType.EXECUTION_COMPLETE));
            traceLog.release(executionId);
        }

        assertEquals(0, traceLog.counterCount());

        TraceEvent next = traceLog.append(event("exec-3", TraceEventType.EXECUTION_RESUME));

        assertEquals(3, next.getSequenceNumber());
        assertEquals(1, traceLog.counterCount());
    }

    @Test
    void shouldKeepSequenceGapFreeWhileReleasing() throws Exception {
        int appends = 50;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < appends; i++) {
                futures.add(pool.submit(() -> traceLog.append(event("exec-1", TraceEventType.TOOL_CALL))));
                futures.add(pool.submit(() -> traceLog.release("exec-1")));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(LongStream.rangeClosed(1, appends).boxed().toList(), sequences("exec-1"));
    }

    @Test
    void shouldKeepSequenceGapFreeUnderConcurrentAppends() throws Exception {
        int appends = 50;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < appends; i++) {
                futures.add(pool.submit(() -> traceLog.append(event("exec-1", TraceEventType.TOOL_CALL))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(LongStream.rangeClosed(1, appends).boxed().toList(), sequences("exec-1"));
    }

    @Test
    void shouldSkipUnreadableLines() throws Exception {
        traceLog.append(event("exec-1", TraceEventType.EXECUTION_START));
        storage.appendText("trace", "exec-1.jsonl", "not json\n").get();

        assertEquals(1, traceLog.list("exec-1").size());
    }

    @Test
    void shouldListNothingForUnknownExecution() {
        assertTrue(traceLog.list("missing").isEmpty());
    }

    private List<Long> sequences(String executionId) {
        return traceLog.list(executionId).stream().map(TraceEvent::getSequenceNumber).toList();
    }

    private static TraceEvent event(String executionId, TraceEventType type) {
        return TraceEvent.builder().executionId(executionId).type(type).build();
    }
}
