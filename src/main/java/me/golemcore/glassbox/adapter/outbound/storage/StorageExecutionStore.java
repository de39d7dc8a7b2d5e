package me.golemcore.glassbox.adapter.outbound.storage;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.exception.ExecutionNotFoundException;
import me.golemcore.glassbox.domain.model.ControlSignal;
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.domain.model.ExecutionProbe;
import me.golemcore.glassbox.domain.model.ExecutionStatus;
import me.golemcore.glassbox.domain.model.StoredCheckpoint;
import me.golemcore.glassbox.domain.model.TokenTotals;
import me.golemcore.glassbox.port.outbound.CheckpointPort;
import me.golemcore.glassbox.port.outbound.ExecutionPort;
import me.golemcore.glassbox.port.outbound.ExecutionStatusProbe;
import me.golemcore.glassbox.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Execution rows kept as one JSON document per execution under
 * {@code executions/<id>.json}, checkpoint included. Every read-modify-write
 * runs under a per-execution lock and ends in an atomic file replace, which
 * makes each operation serializable per execution id within the process.
 *
 * <p>
 * A terminal status is never replaced, except that a {@code failed} execution
 * whose fault is retryable may be claimed back to {@code running}. Stored
 * token totals only grow. The lock of an execution is dropped once it reaches
 * a final status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageExecutionStore implements ExecutionPort, CheckpointPort, ExecutionStatusProbe {

    private static final String EXECUTIONS_DIR = "executions";
    private static final String JSON_EXTENSION = ".json";
    private static final String HUMAN_INPUT_RESPONSE = "humanInputResponse";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    // ==================== ExecutionPort ====================

    @Override
    public Execution create(String nodeId, String modelId) {
        Execution execution = Execution.builder()
                .id(UUID.randomUUID().toString())
                .nodeId(nodeId)
                .modelId(modelId)
                .status(ExecutionStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        write(execution);
        log.info("[Storage] Created execution {} for node {}", execution.getId(), nodeId);
        return execution;
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        return read(executionId);
    }

    @Override
    public Optional<Execution> findActiveByNodeId(String nodeId) {
        return findByNodeId(nodeId).stream()
                .filter(execution -> execution.getStatus() != null
                        && (execution.getStatus().isActive() || execution.isResumableAfterFault()))
                .findFirst();
    }

    @Override
    public List<Execution> findByNodeId(String nodeId) {
        List<Execution> result = new ArrayList<>();
        for (String file : storagePort.listObjects(EXECUTIONS_DIR, "").join()) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            String id = file.substring(0, file.length() - JSON_EXTENSION.length());
            read(id).filter(execution -> nodeId.equals(execution.getNodeId())).ifPresent(result::add);
        }
        result.sort(Comparator.comparing(Execution::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return result;
    }

    @Override
    public Execution updateStatus(String executionId, ExecutionStatus status, String errorMessage,
            TokenTotals tokens) {
        return mutate(executionId, execution -> {
            if (execution.isTerminal() && execution.getStatus() != status) {
                log.warn("[Storage] Execution {} is already {}, ignoring transition to {}",
                        executionId, execution.getStatus().getValue(), status.getValue());
                return null;
            }
            applyStatus(execution, status);
            execution.setErrorMessage(errorMessage);
            execution.setRetryable(false);
            applyTokens(execution, tokens);
            return execution;
        }).orElseGet(() -> read(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId)));
    }

    @Override
    public Execution recordFault(String executionId, String errorMessage, TokenTotals tokens, boolean retryable) {
        return mutate(executionId, execution -> {
            if (execution.isTerminal() && execution.getStatus() != ExecutionStatus.FAILED) {
                log.warn("[Storage] Execution {} is already {}, not recording fault",
                        executionId, execution.getStatus().getValue());
                return null;
            }
            applyStatus(execution, ExecutionStatus.FAILED);
            execution.setErrorMessage(errorMessage);
            execution.setRetryable(retryable);
            execution.setFaultCount(execution.getFaultCount() + 1);
            applyTokens(execution, tokens);
            return execution;
        }).orElseGet(() -> read(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId)));
    }

    @Override
    public void updateModel(String executionId, String modelId) {
        mutate(executionId, execution -> {
            execution.setModelId(modelId);
            return execution;
        });
    }

    @Override
    public Optional<Execution> compareAndSetStatus(String executionId, Set<ExecutionStatus> expected,
            ExecutionStatus target) {
        return mutate(executionId, execution -> {
            if (!expected.contains(execution.getStatus())) {
                return null;
            }
            if (execution.getStatus() == ExecutionStatus.FAILED && !execution.isRetryable()) {
                return null;
            }
            applyStatus(execution, target);
            execution.setRetryable(false);
            if (target == ExecutionStatus.RUNNING) {
                execution.setErrorMessage(null);
            }
            return execution;
        });
    }

    @Override
    public Optional<Execution> submitHumanInput(String executionId, JsonNode response) {
        return mutate(executionId, execution -> {
            if (execution.getStatus() != ExecutionStatus.AWAITING_INPUT) {
                return null;
            }
            ObjectNode checkpoint = execution.getCheckpoint() instanceof ObjectNode existing
                    ? existing
                    : objectMapper.createObjectNode();
            checkpoint.set(HUMAN_INPUT_RESPONSE, response);
            execution.setCheckpoint(checkpoint);
            applyStatus(execution, ExecutionStatus.RUNNING);
            return execution;
        });
    }

    // ==================== CheckpointPort ====================

    @Override
    public void save(String executionId, String serializedState, TokenTotals tokens) {
        JsonNode state = parse(serializedState);
        mutate(executionId, execution -> {
            execution.setCheckpoint(state);
            applyTokens(execution, tokens);
            return execution;
        });
    }

    @Override
    public StoredCheckpoint load(String executionId) {
        Execution execution = read(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
        JsonNode checkpoint = execution.getCheckpoint();
        String state = checkpoint == null || checkpoint.isNull() ? null : checkpoint.toString();
        return new StoredCheckpoint(state, execution.getTokenTotals());
    }

    // ==================== ExecutionStatusProbe ====================

    @Override
    public ExecutionProbe probe(String executionId) {
        Optional<Execution> found = read(executionId);
        if (found.isEmpty()) {
            return ExecutionProbe.cancelled();
        }
        Execution execution = found.get();
        ExecutionStatus status = execution.getStatus();
        if (status == ExecutionStatus.PAUSED) {
            return new ExecutionProbe(ControlSignal.PAUSE, null);
        }
        if (status == null || status.isTerminal()) {
            return ExecutionProbe.cancelled();
        }
        JsonNode response = null;
        if (status == ExecutionStatus.RUNNING && execution.getCheckpoint() != null) {
            JsonNode candidate = execution.getCheckpoint().get(HUMAN_INPUT_RESPONSE);
            if (candidate != null && !candidate.isNull()) {
                response = candidate;
            }
        }
        return new ExecutionProbe(ControlSignal.CONTINUE, response);
    }

    // ==================== internals ====================

    /**
     * Applies {@code change} under the execution's lock. The change returns
     * {@code null} to leave the document untouched.
     */
    private Optional<Execution> mutate(String executionId, UnaryOperator<Execution> change) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(executionId, id -> new ReentrantLock());
            lock.lock();
            try {
                if (locks.get(executionId) != lock) {
                    // evicted while we waited
                    continue;
                }
                Optional<Execution> current = read(executionId);
                if (current.isEmpty()) {
                    locks.remove(executionId, lock);
                    throw new ExecutionNotFoundException(executionId);
                }
                Execution changed = change.apply(current.get());
                if (changed != null) {
                    write(changed);
                }
                Execution result = changed != null ? changed : current.get();
                if (result.isTerminal() && !result.isResumableAfterFault() && !lock.hasQueuedThreads()) {
                    locks.remove(executionId, lock);
                }
                return Optional.ofNullable(changed);
            } finally {
                lock.unlock();
            }
        }
    }

    int lockCount() {
        return locks.size();
    }

    private void applyStatus(Execution execution, ExecutionStatus status) {
        execution.setStatus(status);
        if (status == ExecutionStatus.RUNNING && execution.getStartedAt() == null) {
            execution.setStartedAt(clock.instant());
        }
        if (status == ExecutionStatus.RUNNING) {
            execution.setCompletedAt(null);
        }
        if (status.isTerminal()) {
            execution.setCompletedAt(clock.instant());
        }
    }

    private void applyTokens(Execution execution, TokenTotals tokens) {
        if (tokens == null) {
            return;
        }
        TokenTotals merged = execution.getTokenTotals().max(tokens);
        execution.setTotalTokensIn(merged.tokensIn());
        execution.setTotalTokensOut(merged.tokensOut());
    }

    private Optional<Execution> read(String executionId) {
        String json = storagePort.getText(EXECUTIONS_DIR, executionId + JSON_EXTENSION).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Execution.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted execution document: " + executionId, e);
        }
    }

    private void write(Execution execution) {
        try {
            String json = objectMapper.writeValueAsString(execution);
            storagePort.putTextAtomic(EXECUTIONS_DIR, execution.getId() + JSON_EXTENSION, json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution: " + execution.getId(), e);
        }
    }

    private JsonNode parse(String serializedState) {
        try {
            return objectMapper.readTree(serializedState);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Checkpoint is not valid JSON", e);
        }
    }
}
