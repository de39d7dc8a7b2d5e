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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.loop.ExecutionController;
import me.golemcore.glassbox.domain.loop.ExecutionOutcome;
import me.golemcore.glassbox.domain.model.AgentJob;
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.port.outbound.ExecutionPort;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one queued job and decides whether the transport may forget it.
 *
 * <p>
 * A job is acknowledged when it ran to a terminal or suspended outcome, when it
 * is malformed, or when its execution is missing or finished for good. A job
 * whose run threw, or whose execution is already being run by this process, is
 * left for redelivery. A redelivered job picks up an execution failed by a
 * retryable fault from its checkpoint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentJobHandler {

    private final ExecutionController executionController;
    private final ExecutionPort executionPort;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public enum Disposition {
        ACK, RETRY
    }

    public Disposition handle(AgentJob job) {
        if (job == null || !job.isWellFormed()) {
            log.warn("[Worker] Dropping malformed job: {}", job);
            return Disposition.ACK;
        }

        String executionId = job.getExecutionId();
        Optional<Execution> execution = executionPort.findById(executionId);
        if (execution.isEmpty()) {
            log.warn("[Worker] Dropping job for unknown execution {}", executionId);
            return Disposition.ACK;
        }
        if (execution.get().isTerminal() && !execution.get().isResumableAfterFault()) {
            log.info("[Worker] Execution {} already {}, acknowledging job", executionId,
                    execution.get().getStatus().getValue());
            return Disposition.ACK;
        }

        if (!inFlight.add(executionId)) {
            log.warn("[Worker] Execution {} is already running in this process, leaving job for redelivery",
                    executionId);
            return Disposition.RETRY;
        }
        try {
            ExecutionOutcome outcome = executionController.run(job.getNodeId(), executionId, job.getOrgConfig(),
                    job.getOrgId());
            log.info("[Worker] Execution {} finished as {} after {} iterations", executionId,
                    outcome.status().getValue(), outcome.iterations());
            return Disposition.ACK;
        } catch (RuntimeException e) { // NOSONAR - the transport redelivers the job
            log.error("[Worker] Execution {} failed: {}", executionId, e.getMessage(), e);
            return Disposition.RETRY;
        } finally {
            inFlight.remove(executionId);
        }
    }

    public boolean isRunning(String executionId) {
        return inFlight.contains(executionId);
    }
}
