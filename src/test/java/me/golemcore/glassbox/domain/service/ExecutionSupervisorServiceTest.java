package me.golemcore.glassbox.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.glassbox.domain.exception.ExecutionNotFoundException;
import me.golemcore.glassbox.domain.exception.ExecutionStateException;
import me.golemcore.glassbox.domain.exception.JobDispatchException;
import me.golemcore.glassbox.domain.exception.NodeNotFoundException;
import me.golemcore.glassbox.domain.model.AgentJob;
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.domain.model.ExecutionStatus;
import me.golemcore.glassbox.domain.model.ExecutionView;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.OrgConfig;
import me.golemcore.glassbox.domain.model.TokenTotals;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.ExecutionPort;
import me.golemcore.glassbox.port.outbound.JobQueuePort;
import me.golemcore.glassbox.port.outbound.NodePort;
import me.golemcore.glassbox.port.outbound.TraceLogPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionSupervisorServiceTest {

    private static final Set<ExecutionStatus> CANCELLABLE = EnumSet.of(ExecutionStatus.PENDING,
            ExecutionStatus.RUNNING, ExecutionStatus.PAUSED, ExecutionStatus.AWAITING_INPUT, ExecutionStatus.FAILED);

    private static final String NODE_ID = "node-1";
    private static final String EXEC_ID = "exec-1";
    private static final String ORG_ID = "org-1";
    private static final String DEFAULT_MODEL = "anthropic/claude-sonnet-4-20250514";

    private ExecutionPort executionPort;
    private NodePort nodePort;
    private TraceLogPort traceLogPort;
    private JobQueuePort jobQueuePort;
    private ObjectMapper objectMapper;
    private ExecutionSupervisorService service;

    @BeforeEach
    void setUp() {
        executionPort = mock(ExecutionPort.class);
        nodePort = mock(NodePort.class);
        traceLogPort = mock(TraceLogPort.class);
        jobQueuePort = mock(JobQueuePort.class);
        objectMapper = new ObjectMapper();
        service = new ExecutionSupervisorService(executionPort, nodePort, traceLogPort, jobQueuePort,
                new AgentProperties(), objectMapper);

        when(nodePort.findById(NODE_ID)).thenReturn(Optional.of(Node.builder()
                .id(NODE_ID)
                .orgId(ORG_ID)
                .title("Write report")
                .build()));
    }

    // ===== Start =====

    @Test
    void shouldCreateExecutionAndDispatchJob() {
        Execution created = execution(ExecutionStatus.PENDING);
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.empty());
        when(executionPort.create(NODE_ID, "openai/gpt-4o")).thenReturn(created);
        OrgConfig config = OrgConfig.builder().defaultModel("openai/gpt-4o").apiKey("sk-org").build();

        Execution result = service.start(NODE_ID, config);

        assertSame(created, result);
        ArgumentCaptor<AgentJob> captor = ArgumentCaptor.forClass(AgentJob.class);
        verify(jobQueuePort).send(captor.capture());
        AgentJob job = captor.getValue();
        assertEquals(NODE_ID, job.getNodeId());
        assertEquals(EXEC_ID, job.getExecutionId());
        assertEquals(ORG_ID, job.getOrgId());
        assertEquals("sk-org", job.getOrgConfig().getApiKey());
    }

    @Test
    void shouldUseDefaultModelWithoutOrgConfig() {
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.empty());
        when(executionPort.create(NODE_ID, DEFAULT_MODEL)).thenReturn(execution(ExecutionStatus.PENDING));

        service.start(NODE_ID, null);

        verify(executionPort).create(NODE_ID, DEFAULT_MODEL);
    }

    @Test
    void shouldRejectStartWhenNodeMissing() {
        when(nodePort.findById("missing")).thenReturn(Optional.empty());

        assertThrows(NodeNotFoundException.class, () -> service.start("missing", null));
        verify(executionPort, never()).create(anyString(), anyString());
    }

    @Test
    void shouldRejectSecondActiveExecution() {
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));

        ExecutionStateException error = assertThrows(ExecutionStateException.class,
                () -> service.start(NODE_ID, null));

        assertTrue(error.getMessage().contains("already has an active execution"));
        verify(jobQueuePort, never()).send(any());
    }

    @Test
    void shouldFailExecutionWhenDispatchFails() {
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.empty());
        when(executionPort.create(NODE_ID, DEFAULT_MODEL)).thenReturn(execution(ExecutionStatus.PENDING));
        doThrow(new IllegalStateException("queue down")).when(jobQueuePort).send(any());

        JobDispatchException error = assertThrows(JobDispatchException.class, () -> service.start(NODE_ID, null));

        assertEquals("Failed to dispatch job: queue down", error.getMessage());
        verify(executionPort).updateStatus(EXEC_ID, ExecutionStatus.FAILED, "Failed to dispatch job: queue down",
                TokenTotals.ZERO);
    }

    // ===== Pause / resume / cancel =====

    @Test
    void shouldPauseOnlyRunningExecution() {
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));
        when(executionPort.compareAndSetStatus(EXEC_ID, EnumSet.of(ExecutionStatus.RUNNING), ExecutionStatus.PAUSED))
                .thenReturn(Optional.of(execution(ExecutionStatus.PAUSED)));

        Execution paused = service.pause(EXEC_ID);

        assertEquals(ExecutionStatus.PAUSED, paused.getStatus());
        verify(jobQueuePort, never()).send(any());
    }

    @Test
    void shouldRejectPauseOfCompletedExecution() {
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.COMPLETE)));
        when(executionPort.compareAndSetStatus(eq(EXEC_ID), any(), eq(ExecutionStatus.PAUSED)))
                .thenReturn(Optional.empty());

        ExecutionStateException error = assertThrows(ExecutionStateException.class, () -> service.pause(EXEC_ID));

        assertEquals("Cannot pause execution exec-1 in status complete", error.getMessage());
    }

    @Test
    void shouldThrowNotFoundForUnknownExecution() {
        when(executionPort.findById("nope")).thenReturn(Optional.empty());

        assertThrows(ExecutionNotFoundException.class, () -> service.cancel("nope"));
        assertThrows(ExecutionNotFoundException.class, () -> service.trace("nope"));
    }

    @Test
    void shouldResumeWithStoredModelWhenNoConfigGiven() {
        Execution paused = execution(ExecutionStatus.PAUSED);
        Execution running = execution(ExecutionStatus.RUNNING);
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(paused));
        when(executionPort.compareAndSetStatus(EXEC_ID, EnumSet.of(ExecutionStatus.PAUSED), ExecutionStatus.RUNNING))
                .thenReturn(Optional.of(running));

        service.resume(EXEC_ID, null);

        ArgumentCaptor<AgentJob> captor = ArgumentCaptor.forClass(AgentJob.class);
        verify(jobQueuePort).send(captor.capture());
        assertEquals("openai/gpt-4o", captor.getValue().getOrgConfig().getDefaultModel());
    }

    @Test
    void shouldRevertResumeWhenDispatchFails() {
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.PAUSED)));
        when(executionPort.compareAndSetStatus(EXEC_ID, EnumSet.of(ExecutionStatus.PAUSED), ExecutionStatus.RUNNING))
                .thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));
        doThrow(new IllegalStateException("queue down")).when(jobQueuePort).send(any());

        assertThrows(JobDispatchException.class, () -> service.resume(EXEC_ID, null));

        verify(executionPort).compareAndSetStatus(EXEC_ID, EnumSet.of(ExecutionStatus.RUNNING),
                ExecutionStatus.PAUSED);
    }

    @Test
    void shouldCancelAnyActiveExecution() {
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.AWAITING_INPUT)));
        when(executionPort.compareAndSetStatus(EXEC_ID, CANCELLABLE, ExecutionStatus.CANCELLED))
                .thenReturn(Optional.of(execution(ExecutionStatus.CANCELLED)));

        assertEquals(ExecutionStatus.CANCELLED, service.cancel(EXEC_ID).getStatus());
    }

    @Test
    void shouldCancelExecutionWaitingToRetryFault() {
        Execution faulted = execution(ExecutionStatus.FAILED);
        faulted.setRetryable(true);
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(faulted));
        when(executionPort.compareAndSetStatus(EXEC_ID, CANCELLABLE, ExecutionStatus.CANCELLED))
                .thenReturn(Optional.of(execution(ExecutionStatus.CANCELLED)));

        assertEquals(ExecutionStatus.CANCELLED, service.cancel(EXEC_ID).getStatus());
        verify(executionPort).compareAndSetStatus(EXEC_ID, EnumSet.of(ExecutionStatus.PENDING,
                ExecutionStatus.RUNNING, ExecutionStatus.PAUSED, ExecutionStatus.AWAITING_INPUT,
                ExecutionStatus.FAILED), ExecutionStatus.CANCELLED);
    }

    // ===== Human input =====

    @Test
    void shouldSubmitInputAndRedispatch() {
        TextNode answer = TextNode.valueOf("Use the Q3 numbers");
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.AWAITING_INPUT)));
        when(executionPort.submitHumanInput(EXEC_ID, answer))
                .thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));

        Execution result = service.provideInput(EXEC_ID, answer, null);

        assertEquals(ExecutionStatus.RUNNING, result.getStatus());
        verify(jobQueuePort).send(any(AgentJob.class));
    }

    @Test
    void shouldRejectInputWhenNotAwaiting() {
        TextNode answer = TextNode.valueOf("yes");
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));
        when(executionPort.submitHumanInput(EXEC_ID, answer)).thenReturn(Optional.empty());

        ExecutionStateException error = assertThrows(ExecutionStateException.class,
                () -> service.provideInput(EXEC_ID, answer, null));

        assertEquals("Cannot provide input to execution exec-1 in status running", error.getMessage());
        verify(jobQueuePort, never()).send(any());
    }

    @Test
    void shouldRejectMissingResponse() {
        assertThrows(IllegalArgumentException.class, () -> service.provideInput(EXEC_ID, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> service.provideInput(EXEC_ID, objectMapper.nullNode(), null));
    }

    @Test
    void shouldRevertInputWhenDispatchFails() {
        TextNode answer = TextNode.valueOf("yes");
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.AWAITING_INPUT)));
        when(executionPort.submitHumanInput(EXEC_ID, answer))
                .thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));
        doThrow(new IllegalStateException("queue down")).when(jobQueuePort).send(any());

        assertThrows(JobDispatchException.class, () -> service.provideInput(EXEC_ID, answer, null));

        verify(executionPort).compareAndSetStatus(EXEC_ID, Set.of(ExecutionStatus.RUNNING),
                ExecutionStatus.AWAITING_INPUT);
    }

    // ===== Queries =====

    @Test
    void shouldExposeCheckpointDetailsInView() {
        ObjectNode checkpoint = objectMapper.createObjectNode();
        checkpoint.put("iteration", 3);
        ObjectNode request = checkpoint.putObject("humanInputRequest");
        request.put("requestType", "question");
        request.put("prompt", "Which quarter?");
        request.putArray("options").add("Q2").add("Q3");
        checkpoint.putNull("humanInputResponse");
        Execution awaiting = execution(ExecutionStatus.AWAITING_INPUT).toBuilder().checkpoint(checkpoint).build();
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(awaiting));

        ExecutionView view = service.get(EXEC_ID);

        assertEquals(3, view.iteration());
        assertEquals("Which quarter?", view.humanInputRequest().getPrompt());
        assertEquals(List.of("Q2", "Q3"), view.humanInputRequest().getOptions());
        assertNull(view.humanInputResponse());
    }

    @Test
    void shouldReturnEmptyViewDetailsWithoutCheckpoint() {
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.PENDING)));

        ExecutionView view = service.get(EXEC_ID);

        assertEquals(0, view.iteration());
        assertNull(view.humanInputRequest());
    }

    @Test
    void shouldPreferActiveExecutionForNode() {
        Execution active = execution(ExecutionStatus.PAUSED);
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.of(active));

        assertSame(active, service.currentForNode(NODE_ID).orElseThrow().execution());
        verify(executionPort, never()).findByNodeId(NODE_ID);
    }

    @Test
    void shouldFallBackToLatestExecutionForNode() {
        Execution older = execution(ExecutionStatus.FAILED).toBuilder()
                .id("exec-old").createdAt(Instant.parse("2026-01-01T00:00:00Z")).build();
        Execution newer = execution(ExecutionStatus.COMPLETE).toBuilder()
                .id("exec-new").createdAt(Instant.parse("2026-02-01T00:00:00Z")).build();
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.empty());
        when(executionPort.findByNodeId(NODE_ID)).thenReturn(List.of(newer, older));

        assertEquals("exec-new", service.currentForNode(NODE_ID).orElseThrow().execution().getId());
    }

    @Test
    void shouldReturnEmptyWhenNodeNeverRan() {
        when(executionPort.findActiveByNodeId(NODE_ID)).thenReturn(Optional.empty());
        when(executionPort.findByNodeId(NODE_ID)).thenReturn(List.of());

        assertTrue(service.currentForNode(NODE_ID).isEmpty());
    }

    @Test
    void shouldListTraceForKnownExecution() {
        when(executionPort.findById(EXEC_ID)).thenReturn(Optional.of(execution(ExecutionStatus.RUNNING)));
        when(traceLogPort.list(EXEC_ID)).thenReturn(List.of());

        assertTrue(service.trace(EXEC_ID).isEmpty());
    }

    private static Execution execution(ExecutionStatus status) {
        return Execution.builder()
                .id(EXEC_ID)
                .nodeId(NODE_ID)
                .status(status)
                .modelId("openai/gpt-4o")
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
