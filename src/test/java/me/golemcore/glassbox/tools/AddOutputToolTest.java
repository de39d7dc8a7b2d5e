package me.golemcore.glassbox.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.glassbox.domain.model.AgentState;
import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.NodeOutput;
import me.golemcore.glassbox.domain.model.OutputDescriptor;
import me.golemcore.glassbox.domain.model.OutputType;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.domain.service.OutputKeyGenerator;
import me.golemcore.glassbox.domain.service.TraceRecorder;
import me.golemcore.glassbox.domain.tool.ToolContext;
import me.golemcore.glassbox.port.outbound.BlobStorePort;
import me.golemcore.glassbox.port.outbound.OutputPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AddOutputToolTest {

    private static final String EXECUTION_ID = "exec-1";
    private static final String ORG_ID = "org-1";
    private static final Instant NOW = Instant.parse("2026-03-14T09:26:53Z");

    private BlobStorePort blobStorePort;
    private OutputPort outputPort;
    private TraceRecorder traceRecorder;
    private AddOutputTool tool;
    private AgentState state;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        blobStorePort = mock(BlobStorePort.class);
        outputPort = mock(OutputPort.class);
        traceRecorder = mock(TraceRecorder.class);
        when(blobStorePort.getBucket()).thenReturn("glassbox-files");
        when(blobStorePort.upload(any(), anyString(), anyString(), anyMap()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(invocation.getArgument(1)));
        tool = new AddOutputTool(blobStorePort, outputPort, new OutputKeyGenerator(clock), traceRecorder,
                new ObjectMapper(), clock);
        state = new AgentState();
        context = new ToolContext(EXECUTION_ID, Node.builder().id("node-1").orgId(ORG_ID).build(), ORG_ID, state);
    }

    // ===== Happy path =====

    @Test
    @SuppressWarnings("unchecked")
    void shouldUploadTextAndRecordOutput() {
        ToolResult result = tool.execute(context, new ToolInvocation.AddOutput(OutputType.TEXT, "Hello", "greeting"))
                .join();

        assertTrue(result.isSuccess());
        assertEquals("Added output: greeting (stored in blob storage)", result.getOutput());

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, String>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(blobStorePort).upload(bytes.capture(), key.capture(), eq("text/plain"), metadata.capture());
        assertEquals("Hello", new String(bytes.getValue(), StandardCharsets.UTF_8));
        assertTrue(key.getValue().matches(
                "outputs/org-1/exec-1/20260314_092653_text_[0-9a-f]{8}\\.txt"), key.getValue());
        assertEquals(Map.of("execution_id", EXECUTION_ID, "node_id", "node-1", "output_type", "text",
                "label", "greeting"), metadata.getValue());
    }

    @Test
    void shouldWriteFileRecordAndNodeOutput() {
        tool.execute(context, new ToolInvocation.AddOutput(OutputType.TEXT, "Hello", "greeting")).join();

        ArgumentCaptor<FileRecord> file = ArgumentCaptor.forClass(FileRecord.class);
        ArgumentCaptor<NodeOutput> output = ArgumentCaptor.forClass(NodeOutput.class);
        verify(outputPort).record(file.capture(), output.capture());

        assertEquals(ORG_ID, file.getValue().getOrgId());
        assertEquals("glassbox-files", file.getValue().getStorageBucket());
        assertEquals("greeting.txt", file.getValue().getFilename());
        assertEquals(5, file.getValue().getSizeBytes());
        assertEquals(FileRecord.PROCESSING_COMPLETE, file.getValue().getProcessingStatus());
        assertEquals("agent_output", file.getValue().getMetadata().get("source"));
        assertEquals(NOW, file.getValue().getCreatedAt());

        assertEquals("node-1", output.getValue().getNodeId());
        assertEquals(file.getValue().getId(), output.getValue().getFileId());
        assertEquals(file.getValue().getStorageKey(), output.getValue().getMetadata().get("storage_key"));
    }

    @Test
    void shouldAppendDescriptorToState() {
        tool.execute(context, new ToolInvocation.AddOutput(OutputType.TEXT, "Hello", null)).join();

        assertEquals(1, state.getOutputs().size());
        OutputDescriptor descriptor = state.getOutputs().get(0);
        assertEquals(OutputType.TEXT, descriptor.getType());
        assertEquals("text", descriptor.getLabel());
        assertEquals(5, descriptor.getSizeBytes());
        verify(traceRecorder).record(eq(EXECUTION_ID), eq(TraceEventType.OUTPUT_ADDED), anyMap());
    }

    @Test
    void shouldStoreStructuredDataCompacted() {
        ToolResult result = tool.execute(context,
                new ToolInvocation.AddOutput(OutputType.STRUCTURED_DATA, "{ \"a\" : [1, 2] }", "plan")).join();

        assertTrue(result.isSuccess());
        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(blobStorePort).upload(bytes.capture(), anyString(), eq("application/json"), anyMap());
        assertEquals("{\"a\":[1,2]}", new String(bytes.getValue(), StandardCharsets.UTF_8));
    }

    // ===== Validation =====

    @Test
    void shouldRejectInvalidStructuredDataWithoutSideEffects() {
        ToolResult result = tool.execute(context,
                new ToolInvocation.AddOutput(OutputType.STRUCTURED_DATA, "{not json", "plan")).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("structured_data content is not valid JSON"));
        verify(blobStorePort, never()).upload(any(), anyString(), anyString(), anyMap());
        verifyNoInteractions(outputPort, traceRecorder);
        assertTrue(state.getOutputs().isEmpty());
    }

    @Test
    void shouldRejectNodeWithoutOrganization() {
        ToolContext orphan = new ToolContext(EXECUTION_ID, Node.builder().id("node-1").build(), null, state);

        ToolResult result = tool.execute(orphan, new ToolInvocation.AddOutput(OutputType.TEXT, "x", null)).join();

        assertEquals("Node node-1 has no organization", result.getError());
        verifyNoInteractions(outputPort);
    }

    // ===== Faults =====

    @Test
    void shouldNotRecordWhenUploadFails() {
        when(blobStorePort.upload(any(), anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        CompletableFuture<ToolResult> future = tool.execute(context,
                new ToolInvocation.AddOutput(OutputType.TEXT, "x", null));

        CompletionException error = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        verifyNoInteractions(outputPort);
        assertTrue(state.getOutputs().isEmpty());
    }
}
