package me.golemcore.glassbox.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.exception.ExecutionNotFoundException;
import me.golemcore.glassbox.domain.exception.ExecutionStateException;
import me.golemcore.glassbox.domain.exception.JobDispatchException;
import me.golemcore.glassbox.domain.exception.NodeNotFoundException;
import me.golemcore.glassbox.domain.model.AgentJob;
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.domain.model.ExecutionStatus;
import me.golemcore.glassbox.domain.model.ExecutionView;
import me.golemcore.glassbox.domain.model.HumanInputRequest;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.OrgConfig;
import me.golemcore.glassbox.domain.model.TokenTotals;
import me.golemcore.glassbox.domain.model.TraceEvent;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.ExecutionPort;
import me.golemcore.glassbox.port.outbound.JobQueuePort;
import me.golemcore.glassbox.port.outbound.NodePort;
import me.golemcore.glassbox.port.outbound.TraceLogPort;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Out-of-band control of executions: start, pause, resume, cancel and human
 * answers. Every transition is a compare-and-set on the execution row; the
 * running engine observes it at its next iteration boundary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionSupervisorService {

    private static final String CHECKPOINT_ITERATION = "iteration";
    private static final String CHECKPOINT_REQUEST = "humanInputRequest";
    private static final String CHECKPOINT_RESPONSE = "humanInputResponse";
    // a failed execution is only taken when its fault is still being retried
    private static final Set<ExecutionStatus> CANCELLABLE = EnumSet.of(ExecutionStatus.PENDING,
            ExecutionStatus.RUNNING, ExecutionStatus.PAUSED, ExecutionStatus.AWAITING_INPUT, ExecutionStatus.FAILED);

    private final ExecutionPort executionPort;
    private final NodePort nodePort;
    private final TraceLogPort traceLogPort;
    private final JobQueuePort jobQueuePort;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Creates a pending execution for the node and dispatches its first job.
     *
     * @throws NodeNotFoundException
     *             if the node does not exist
     * @throws ExecutionStateException
     *             if the node already has an active execution
     * @throws JobDispatchException
     *             if the job could not be queued; the execution is then failed
     */
    public synchronized Execution start(String nodeId, OrgConfig orgConfig) {
        Node node = nodePort.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        Optional<Execution> active = executionPort.findActiveByNodeId(nodeId);
        if (active.isPresent()) {
            throw new ExecutionStateException("Node " + nodeId + " already has an active execution: "
                    + active.get().getId() + " (" + active.get().getStatus().getValue() + ")");
        }

        OrgConfig config = orgConfig != null ? orgConfig : OrgConfig.empty();
        Execution execution = executionPort.create(nodeId, config.resolveModel(properties.getLlm().getDefaultModel()));
        log.info("[Supervisor] Starting execution {} for node {}", execution.getId(), nodeId);
        try {
            dispatch(node, execution.getId(), config);
        } catch (RuntimeException e) { // NOSONAR
            String message = "Failed to dispatch job: " + e.getMessage();
            executionPort.updateStatus(execution.getId(), ExecutionStatus.FAILED, message, TokenTotals.ZERO);
            throw new JobDispatchException(message, e);
        }
        return execution;
    }

    public Execution pause(String executionId) {
        Execution execution = transition(executionId, EnumSet.of(ExecutionStatus.RUNNING), ExecutionStatus.PAUSED,
                "pause");
        log.info("[Supervisor] Paused execution {}", executionId);
        return execution;
    }

    public Execution resume(String executionId, OrgConfig orgConfig) {
        Execution execution = transition(executionId, EnumSet.of(ExecutionStatus.PAUSED), ExecutionStatus.RUNNING,
                "resume");
        redispatch(execution, orgConfig, ExecutionStatus.PAUSED);
        log.info("[Supervisor] Resumed execution {}", executionId);
        return execution;
    }

    public Execution cancel(String executionId) {
        Execution execution = transition(executionId, CANCELLABLE, ExecutionStatus.CANCELLED, "cancel");
        log.info("[Supervisor] Cancelled execution {}", executionId);
        return execution;
    }

    /**
     * Stores the human answer in the checkpoint and re-dispatches the
     * execution. Only allowed while it is awaiting input.
     */
    public Execution provideInput(String executionId, JsonNode response, OrgConfig orgConfig) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            throw new IllegalArgumentException("response is required");
        }
        Execution current = require(executionId);
        Execution execution = executionPort.submitHumanInput(executionId, response)
                .orElseThrow(() -> notAllowed(current, "provide input to"));
        redispatch(execution, orgConfig, ExecutionStatus.AWAITING_INPUT);
        log.info("[Supervisor] Human input provided for execution {}", executionId);
        return execution;
    }

    // ==================== Queries ====================

    public ExecutionView get(String executionId) {
        return toView(require(executionId));
    }

    /**
     * The node's active execution, or its most recent one when none is active.
     */
    public Optional<ExecutionView> currentForNode(String nodeId) {
        Optional<Execution> active = executionPort.findActiveByNodeId(nodeId);
        if (active.isPresent()) {
            return active.map(this::toView);
        }
        return executionPort.findByNodeId(nodeId).stream()
                .max(Comparator.comparing(Execution::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(this::toView);
    }

    public List<TraceEvent> trace(String executionId) {
        require(executionId);
        return traceLogPort.list(executionId);
    }

    // ==================== Internals ====================

    private Execution transition(String executionId, Set<ExecutionStatus> expected, ExecutionStatus target,
            String action) {
        Execution current = require(executionId);
        return executionPort.compareAndSetStatus(executionId, expected, target)
                .orElseThrow(() -> notAllowed(current, action));
    }

    private void redispatch(Execution execution, OrgConfig orgConfig, ExecutionStatus revertTo) {
        Node node = nodePort.findById(execution.getNodeId())
                .orElseThrow(() -> new NodeNotFoundException(execution.getNodeId()));
        OrgConfig config = orgConfig != null ? orgConfig : OrgConfig.builder()
                .defaultModel(execution.getModelId())
                .build();
        try {
            dispatch(node, execution.getId(), config);
        } catch (RuntimeException e) { // NOSONAR
            executionPort.compareAndSetStatus(execution.getId(), EnumSet.of(ExecutionStatus.RUNNING), revertTo);
            log.error("[Supervisor] Dispatch failed for execution {}, reverted to {}", execution.getId(),
                    revertTo.getValue(), e);
            throw new JobDispatchException("Failed to dispatch job: " + e.getMessage(), e);
        }
    }

    private void dispatch(Node node, String executionId, OrgConfig config) {
        jobQueuePort.send(AgentJob.builder()
                .nodeId(node.getId())
                .executionId(executionId)
                .orgId(node.getOrgId())
                .orgConfig(config)
                .build());
    }

    private Execution require(String executionId) {
        return executionPort.findById(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    private static ExecutionStateException notAllowed(Execution execution, String action) {
        ExecutionStatus status = execution.getStatus();
        return new ExecutionStateException("Cannot " + action + " execution " + execution.getId() + " in status "
                + (status != null ? status.getValue() : "unknown"));
    }

    private ExecutionView toView(Execution execution) {
        JsonNode checkpoint = execution.getCheckpoint();
        if (checkpoint == null || !checkpoint.isObject()) {
            return new ExecutionView(execution, 0, null, null);
        }
        HumanInputRequest request = null;
        JsonNode requestNode = checkpoint.get(CHECKPOINT_REQUEST);
        if (requestNode != null && requestNode.isObject()) {
            try {
                request = objectMapper.treeToValue(requestNode, HumanInputRequest.class);
            } catch (JsonProcessingException e) {
                log.warn("[Supervisor] Unreadable human input request on execution {}: {}", execution.getId(),
                        e.getOriginalMessage());
            }
        }
        JsonNode response = checkpoint.get(CHECKPOINT_RESPONSE);
        return new ExecutionView(execution, checkpoint.path(CHECKPOINT_ITERATION).asInt(0), request,
                response == null || response.isNull() ? null : response);
    }
}
