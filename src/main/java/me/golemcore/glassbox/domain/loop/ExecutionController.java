package me.golemcore.glassbox.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.exception.AgentExecutionException;
import me.golemcore.glassbox.domain.exception.ExecutionNotFoundException;
import me.golemcore.glassbox.domain.exception.NodeNotFoundException;
import me.golemcore.glassbox.domain.model.AgentState;
import me.golemcore.glassbox.domain.model.ControlSignal;
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.domain.model.ExecutionProbe;
import me.golemcore.glassbox.domain.model.ExecutionStatus;
import me.golemcore.glassbox.domain.model.LlmRequest;
import me.golemcore.glassbox.domain.model.LlmResponse;
import me.golemcore.glassbox.domain.model.LlmUsage;
import me.golemcore.glassbox.domain.model.Message;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.OrgConfig;
import me.golemcore.glassbox.domain.model.StoredCheckpoint;
import me.golemcore.glassbox.domain.model.TokenTotals;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.domain.service.CheckpointSerializer;
import me.golemcore.glassbox.domain.service.SystemPromptBuilder;
import me.golemcore.glassbox.domain.service.TraceRecorder;
import me.golemcore.glassbox.domain.tool.AgentToolCatalog;
import me.golemcore.glassbox.domain.tool.AgentToolDispatcher;
import me.golemcore.glassbox.domain.tool.ToolContext;
import me.golemcore.glassbox.domain.tool.ToolExecutionOutcome;
import me.golemcore.glassbox.domain.tool.TranscriptWriter;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.CheckpointPort;
import me.golemcore.glassbox.port.outbound.ExecutionPort;
import me.golemcore.glassbox.port.outbound.ExecutionStatusProbe;
import me.golemcore.glassbox.port.outbound.LlmPort;
import me.golemcore.glassbox.port.outbound.NodePort;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Drives one execution from its current checkpoint to a completed, suspended or
 * failed state.
 *
 * <p>
 * Each iteration:
 * <ol>
 * <li>probe the execution row: cancel returns at once, pause saves a
 * checkpoint and returns, a pending human response is appended and
 * checkpointed</li>
 * <li>call the LLM gateway with the whole transcript and the tool schema</li>
 * <li>dispatch the returned tool calls in order, or look for "complete" in a
 * plain text answer</li>
 * <li>count the iteration and save the checkpoint</li>
 * </ol>
 * The loop fails with {@value #MAX_ITERATIONS_MESSAGE} once the iteration cap
 * is reached.
 *
 * <p>
 * Pause and cancel are cooperative: a status change is seen at the next
 * iteration boundary, so one gateway round-trip plus one tool batch may still
 * run after it. Any fault inside the loop is recorded as an {@code error}
 * trace event and a {@code failed} status, then rethrown as
 * {@link AgentExecutionException} so that the job is redelivered and resumes
 * from the last checkpoint. Such a failure stays resumable until
 * {@code glassbox.engine.max-fault-retries} faults have been recorded; the
 * iteration cap fails the execution for good.
 */
@Component
@Slf4j
public class ExecutionController {

    static final String MAX_ITERATIONS_MESSAGE = "Max iterations reached";
    private static final String COMPLETE_TOKEN = "complete";
    private static final int SUMMARY_LIMIT = 200;
    private static final String MDC_EXECUTION_ID = "executionId";
    private static final String MDC_NODE_ID = "nodeId";
    private static final Set<ExecutionStatus> CLAIMABLE = EnumSet.of(ExecutionStatus.PENDING,
            ExecutionStatus.RUNNING, ExecutionStatus.AWAITING_INPUT, ExecutionStatus.FAILED);

    private final ExecutionPort executionPort;
    private final CheckpointPort checkpointPort;
    private final ExecutionStatusProbe statusProbe;
    private final NodePort nodePort;
    private final LlmPort llmPort;
    private final AgentToolCatalog toolCatalog;
    private final AgentToolDispatcher toolDispatcher;
    private final TranscriptWriter transcriptWriter;
    private final CheckpointSerializer checkpointSerializer;
    private final SystemPromptBuilder systemPromptBuilder;
    private final TraceRecorder traceRecorder;
    private final AgentProperties properties;
    private final Clock clock;

    public ExecutionController(ExecutionPort executionPort, CheckpointPort checkpointPort,
            ExecutionStatusProbe statusProbe, NodePort nodePort, LlmPort llmPort, AgentToolCatalog toolCatalog,
            AgentToolDispatcher toolDispatcher, TranscriptWriter transcriptWriter,
            CheckpointSerializer checkpointSerializer, SystemPromptBuilder systemPromptBuilder,
            TraceRecorder traceRecorder, AgentProperties properties, Clock clock) {
        this.executionPort = executionPort;
        this.checkpointPort = checkpointPort;
        this.statusProbe = statusProbe;
        this.nodePort = nodePort;
        this.llmPort = llmPort;
        this.toolCatalog = toolCatalog;
        this.toolDispatcher = toolDispatcher;
        this.transcriptWriter = transcriptWriter;
        this.checkpointSerializer = checkpointSerializer;
        this.systemPromptBuilder = systemPromptBuilder;
        this.traceRecorder = traceRecorder;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs or resumes an execution.
     *
     * @param nodeId
     *            node the execution works on
     * @param executionId
     *            execution to run
     * @param orgConfig
     *            model and credential overrides, may be {@code null}
     * @param orgId
     *            organization fallback when the node carries none, may be
     *            {@code null}
     * @return how the run ended
     * @throws AgentExecutionException
     *             after a fault has been recorded on the execution
     */
    public ExecutionOutcome run(String nodeId, String executionId, OrgConfig orgConfig, String orgId) {
        MDC.put(MDC_EXECUTION_ID, executionId);
        MDC.put(MDC_NODE_ID, nodeId);
        try {
            Execution execution = executionPort.findById(executionId)
                    .orElseThrow(() -> new ExecutionNotFoundException(executionId));
            StoredCheckpoint stored = checkpointPort.load(executionId);
            if (!isRunnable(execution, stored)) {
                log.info("[Engine] Execution {} is {}, nothing to run", executionId,
                        execution.getStatus().getValue());
                return ExecutionOutcome.skipped(executionId, execution.getStatus(), execution.getTokenTotals());
            }

            OrgConfig config = orgConfig != null ? orgConfig : OrgConfig.empty();
            Run run = new Run(executionId, config, config.resolveModel(properties.getLlm().getDefaultModel()),
                    stored.tokens(), execution.getFaultCount());
            try {
                return execute(run, nodeId, orgId, stored);
            } catch (RuntimeException e) { // NOSONAR - every fault must end as a recorded failure
                throw fail(run, e);
            }
        } finally {
            traceRecorder.release(executionId);
            MDC.remove(MDC_EXECUTION_ID);
            MDC.remove(MDC_NODE_ID);
        }
    }

    // ==================== Run ====================

    private ExecutionOutcome execute(Run run, String nodeId, String orgId, StoredCheckpoint stored) {
        boolean resume = stored.hasState();
        Optional<Execution> claimed = executionPort.compareAndSetStatus(run.executionId, CLAIMABLE,
                ExecutionStatus.RUNNING);
        if (claimed.isEmpty()) {
            Execution current = executionPort.findById(run.executionId)
                    .orElseThrow(() -> new ExecutionNotFoundException(run.executionId));
            log.info("[Engine] Execution {} became {} before it could start", run.executionId,
                    current.getStatus().getValue());
            return ExecutionOutcome.skipped(run.executionId, current.getStatus(), current.getTokenTotals());
        }
        executionPort.updateModel(run.executionId, run.model);

        Node node = nodePort.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        AgentState state;
        if (resume) {
            state = checkpointSerializer.deserialize(stored.state());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", run.model);
            payload.put("iteration", state.getIteration());
            traceRecorder.record(run.executionId, TraceEventType.EXECUTION_RESUME, payload);
            log.info("[Engine] Resuming execution {} at iteration {} ({} messages)", run.executionId,
                    state.getIteration(), state.getMessages().size());
            if (state.hasHumanInputResponse()) {
                applyHumanResponse(run, state, state.consumeHumanInputResponse());
            } else if (state.isHumanInputNeeded()) {
                return suspendForHumanInput(run, state);
            }
        } else {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", run.model);
            traceRecorder.record(run.executionId, TraceEventType.EXECUTION_START, payload);
            log.info("[Engine] Starting execution {} for node {} with model {}", run.executionId, nodeId,
                    run.model);
            state = AgentState.builder().build();
            transcriptWriter.appendOpening(state,
                    systemPromptBuilder.buildSystemPrompt(node, nodePort.findInputs(nodeId)),
                    systemPromptBuilder.buildKickoffMessage(node));
        }

        String effectiveOrgId = node.getOrgId() != null ? node.getOrgId() : orgId;
        ToolContext context = new ToolContext(run.executionId, node, effectiveOrgId, state);
        int maxIterations = properties.getEngine().getMaxIterations();

        while (state.getIteration() < maxIterations) {
            ExecutionProbe probe = statusProbe.probe(run.executionId);
            if (probe.signal() == ControlSignal.CANCEL) {
                log.info("[Engine] Execution {} cancelled", run.executionId);
                traceRecorder.record(run.executionId, TraceEventType.EXECUTION_CANCELLED, iterationPayload(state));
                return outcome(run, ExecutionStatus.CANCELLED, state);
            }
            if (probe.signal() == ControlSignal.PAUSE) {
                log.info("[Engine] Execution {} paused, saving checkpoint", run.executionId);
                saveCheckpoint(run, state);
                traceRecorder.record(run.executionId, TraceEventType.EXECUTION_PAUSED, iterationPayload(state));
                return outcome(run, ExecutionStatus.PAUSED, state);
            }
            if (probe.hasHumanInputResponse()) {
                state.setHumanInputRequest(null);
                applyHumanResponse(run, state, probe.humanInputResponse());
            }

            log.info("[Engine] Iteration {}/{}", state.getIteration() + 1, maxIterations);
            LlmResponse response = callModel(run, state);
            transcriptWriter.appendAssistantTurn(state, response);

            if (response.hasToolCalls()) {
                processToolBatch(context, response.getToolCalls());
            } else if (mentionsCompletion(response.getContent())) {
                state.markComplete(truncate(response.getContent()));
            }
            state.incrementIteration();

            if (state.isComplete()) {
                return finishComplete(run, state);
            }
            if (state.isHumanInputNeeded()) {
                return suspendForHumanInput(run, state);
            }
            saveCheckpoint(run, state);
        }

        log.warn("[Engine] Execution {} reached the iteration cap ({})", run.executionId, maxIterations);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", MAX_ITERATIONS_MESSAGE);
        traceRecorder.record(run.executionId, TraceEventType.ERROR, payload);
        executionPort.updateStatus(run.executionId, ExecutionStatus.FAILED, MAX_ITERATIONS_MESSAGE, run.tokens);
        return outcome(run, ExecutionStatus.FAILED, state);
    }

    /**
     * Dispatches the batch in model order. In drain mode every call runs; in
     * short-circuit mode the first completion or human-input signal ends the
     * batch and the remaining calls get a synthetic result so that every tool
     * call still has its tool turn.
     */
    private void processToolBatch(ToolContext context, List<Message.ToolCall> toolCalls) {
        AgentState state = context.state();
        boolean drain = properties.getEngine().isDrainToolBatch();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolExecutionOutcome outcome = toolDispatcher.dispatch(context, toolCalls.get(i));
            transcriptWriter.appendToolResult(state, outcome);

            if (!drain && (state.isComplete() || state.isHumanInputNeeded())) {
                String reason = state.isComplete()
                        ? "Skipped: node was marked complete earlier in this batch"
                        : "Skipped: waiting for human input requested earlier in this batch";
                for (Message.ToolCall skipped : toolCalls.subList(i + 1, toolCalls.size())) {
                    transcriptWriter.appendToolResult(state, ToolExecutionOutcome.synthetic(skipped, reason));
                }
                return;
            }
        }
    }

    private LlmResponse callModel(Run run, AgentState state) {
        LlmRequest request = LlmRequest.builder()
                .model(run.model)
                .messages(new ArrayList<>(state.getMessages()))
                .tools(toolCatalog.getDefinitions())
                .toolChoice(LlmRequest.ToolChoiceMode.AUTO)
                .maxTokens(properties.getLlm().getMaxTokens())
                .temperature(properties.getLlm().getTemperature())
                .apiKey(run.orgConfig.getApiKey())
                .apiBase(run.orgConfig.getApiBase())
                .executionId(run.executionId)
                .build();

        long startedAt = clock.millis();
        LlmResponse response = await(run, request);
        long durationMs = clock.millis() - startedAt;

        LlmUsage usage = response.getUsage();
        int tokensIn = usage != null ? usage.getInputTokens() : 0;
        int tokensOut = usage != null ? usage.getOutputTokens() : 0;
        run.tokens = run.tokens.plus(tokensIn, tokensOut);
        traceRecorder.recordLlmCall(run.executionId, run.model, durationMs, tokensIn, tokensOut);
        log.debug("[Engine] LLM call took {}ms, tokens {}/{}, {} tool call(s)", durationMs, tokensIn, tokensOut,
                response.hasToolCalls() ? response.getToolCalls().size() : 0);
        return response;
    }

    private LlmResponse await(Run run, LlmRequest request) {
        try {
            LlmResponse response = llmPort.chat(request).join();
            if (response == null) {
                throw new IllegalStateException("LLM gateway returned no response for " + run.executionId);
            }
            return response;
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    // ==================== Terminal and suspended states ====================

    private ExecutionOutcome finishComplete(Run run, AgentState state) {
        saveCheckpoint(run, state);
        executionPort.updateStatus(run.executionId, ExecutionStatus.COMPLETE, null, run.tokens);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", state.getCompletionSummary());
        traceRecorder.record(run.executionId, TraceEventType.EXECUTION_COMPLETE, payload);
        log.info("[Engine] Execution {} complete after {} iteration(s)", run.executionId, state.getIteration());
        return outcome(run, ExecutionStatus.COMPLETE, state);
    }

    private ExecutionOutcome suspendForHumanInput(Run run, AgentState state) {
        saveCheckpoint(run, state);
        Optional<Execution> suspended = executionPort.compareAndSetStatus(run.executionId,
                EnumSet.of(ExecutionStatus.RUNNING), ExecutionStatus.AWAITING_INPUT);
        if (suspended.isEmpty()) {
            ExecutionStatus current = executionPort.findById(run.executionId)
                    .map(Execution::getStatus)
                    .orElse(ExecutionStatus.CANCELLED);
            log.info("[Engine] Execution {} became {} while suspending for input", run.executionId,
                    current.getValue());
            return outcome(run, current, state);
        }
        log.info("[Engine] Execution {} awaiting human input: {}", run.executionId,
                state.getHumanInputRequest() != null ? state.getHumanInputRequest().getPrompt() : null);
        return outcome(run, ExecutionStatus.AWAITING_INPUT, state);
    }

    private AgentExecutionException fail(Run run, RuntimeException error) {
        String message = describe(error);
        log.error("[Engine] Execution {} failed: {}", run.executionId, message, error);
        traceRecorder.recordErrorSafely(run.executionId, message);
        boolean retryable = run.priorFaults < properties.getEngine().getMaxFaultRetries();
        try {
            executionPort.recordFault(run.executionId, message, run.tokens, retryable);
        } catch (RuntimeException statusError) { // NOSONAR - keep the original fault as the cause
            log.error("[Engine] Failed to mark execution {} as failed: {}", run.executionId,
                    statusError.getMessage());
            error.addSuppressed(statusError);
        }
        if (error instanceof AgentExecutionException agentError) {
            return agentError;
        }
        return new AgentExecutionException(run.executionId, message, error);
    }

    // ==================== Helpers ====================

    private boolean isRunnable(Execution execution, StoredCheckpoint stored) {
        ExecutionStatus status = execution.getStatus();
        if (status == ExecutionStatus.PENDING || status == ExecutionStatus.RUNNING
                || execution.isResumableAfterFault()) {
            return true;
        }
        // A scheduler may hand us an answered execution without flipping it to
        // running first.
        return status == ExecutionStatus.AWAITING_INPUT && stored.hasState()
                && checkpointSerializer.deserialize(stored.state()).hasHumanInputResponse();
    }

    private void applyHumanResponse(Run run, AgentState state, JsonNode response) {
        transcriptWriter.appendHumanResponse(state, response);
        state.setHumanInputResponse(null);
        state.setHumanInputNeeded(false);
        saveCheckpoint(run, state);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("response", response);
        traceRecorder.record(run.executionId, TraceEventType.HUMAN_INPUT_RECEIVED, payload);
        log.info("[Engine] Applied human response to execution {}", run.executionId);
    }

    private void saveCheckpoint(Run run, AgentState state) {
        checkpointPort.save(run.executionId, checkpointSerializer.serialize(state), run.tokens);
        log.debug("[Engine] Checkpoint saved at iteration {}", state.getIteration());
    }

    private ExecutionOutcome outcome(Run run, ExecutionStatus status, AgentState state) {
        return new ExecutionOutcome(run.executionId, status, state.getIteration(), run.tokens, true);
    }

    private Map<String, Object> iterationPayload(AgentState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("iteration", state.getIteration());
        return payload;
    }

    private boolean mentionsCompletion(String content) {
        return content != null && content.toLowerCase(Locale.ROOT).contains(COMPLETE_TOKEN);
    }

    private String truncate(String content) {
        return content.length() <= SUMMARY_LIMIT ? content : content.substring(0, SUMMARY_LIMIT);
    }

    private String describe(Throwable error) {
        Throwable root = error;
        while (root instanceof CompletionException && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message != null && !message.isBlank() ? message : root.getClass().getSimpleName();
    }

    /**
     * Per-run mutable data. The controller itself is shared between concurrent
     * executions.
     */
    private static final class Run {
        private final String executionId;
        private final OrgConfig orgConfig;
        private final String model;
        private final int priorFaults;
        private TokenTotals tokens;

        private Run(String executionId, OrgConfig orgConfig, String model, TokenTotals tokens, int priorFaults) {
            this.executionId = executionId;
            this.orgConfig = orgConfig;
            this.model = model;
            this.priorFaults = priorFaults;
            this.tokens = tokens != null ? tokens : TokenTotals.ZERO;
        }
    }
}
