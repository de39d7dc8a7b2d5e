package me.golemcore.glassbox.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.glassbox.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelJsonTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    // ===== Enums =====

    @Test
    void shouldWriteStatusesAsSnakeCase() throws Exception {
        assertEquals("\"awaiting_input\"", objectMapper.writeValueAsString(ExecutionStatus.AWAITING_INPUT));
        assertEquals(ExecutionStatus.AWAITING_INPUT, objectMapper.readValue("\"awaiting_input\"",
                ExecutionStatus.class));
    }

    @Test
    void shouldClassifyStatuses() {
        assertTrue(ExecutionStatus.PAUSED.isActive());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertEquals(4, ExecutionStatus.ACTIVE.size());
    }

    @Test
    void shouldWriteTraceEventTypesAsSnakeCase() throws Exception {
        assertEquals("\"human_input_requested\"",
                objectMapper.writeValueAsString(TraceEventType.HUMAN_INPUT_REQUESTED));
    }

    @Test
    void shouldRejectUnknownAuthorType() {
        assertThrows(IllegalArgumentException.class, () -> AuthorType.fromValue("robot"));
        assertTrue(AuthorType.parse(null).isEmpty());
    }

    // ===== Job payload =====

    @Test
    void shouldWriteJobInSnakeCase() throws Exception {
        AgentJob job = AgentJob.builder().nodeId("n").executionId("e").orgId("o").build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(job));

        assertEquals("n", json.get("node_id").asText());
        assertEquals("e", json.get("execution_id").asText());
        assertFalse(json.has("org_config"));
        assertFalse(json.has("wellFormed"));
    }

    @Test
    void shouldFlagIncompleteJob() throws Exception {
        AgentJob job = objectMapper.readValue("{\"node_id\":\"n\",\"extra\":1}", AgentJob.class);

        assertFalse(job.isWellFormed());
    }

    @Test
    void shouldReadOrgConfigAliases() throws Exception {
        OrgConfig config = objectMapper.readValue(
                "{\"default_model\":\"anthropic/claude-3\",\"api_key\":\"sk\",\"api_base\":\"https://gw\"}",
                OrgConfig.class);

        assertEquals("anthropic/claude-3", config.resolveModel("fallback"));
        assertEquals("sk", config.getApiKey());
        assertEquals("https://gw", config.getApiBase());
        assertEquals("fallback", OrgConfig.empty().resolveModel("fallback"));
    }

    // ===== Transcript =====

    @Test
    void shouldWriteOnlyTranscriptFieldsForMessages() throws Exception {
        Message assistant = Message.assistant(null, List.of(Message.ToolCall.builder()
                .id("call_1")
                .name("mark_complete")
                .arguments("{\"summary\":\"Done\"}")
                .build()));

        JsonNode json = objectMapper.valueToTree(assistant);

        assertEquals("assistant", json.get("role").asText());
        assertEquals("call_1", json.get("toolCalls").get(0).get("id").asText());
        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertEquals(List.of("role", "toolCalls"), fields);
        assertTrue(objectMapper.treeToValue(json, Message.class).hasToolCalls());
    }

    // ===== Execution document =====

    @Test
    void shouldRoundTripExecutionWithIsoTimestamps() throws Exception {
        Execution execution = Execution.builder()
                .id("e")
                .status(ExecutionStatus.RUNNING)
                .totalTokensIn(10)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();

        String json = objectMapper.writeValueAsString(execution);
        Execution restored = objectMapper.readValue(json, Execution.class);

        assertTrue(json.contains("\"createdAt\":\"2026-03-01T10:00:00Z\""), json);
        assertFalse(json.contains("tokenTotals"));
        assertEquals(new TokenTotals(10, 0), restored.getTokenTotals());
    }
}
