package me.golemcore.glassbox.port.outbound;

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
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.domain.model.ExecutionStatus;
import me.golemcore.glassbox.domain.model.TokenTotals;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Execution rows. Status writes maintain {@code startedAt}/{@code completedAt}
 * and never lower stored token totals.
 */
public interface ExecutionPort {

    Execution create(String nodeId, String modelId);

    Optional<Execution> findById(String executionId);

    /**
     * Most recent execution of the node whose status is active, or that failed
     * with a fault it will still resume from.
     */
    Optional<Execution> findActiveByNodeId(String nodeId);

    List<Execution> findByNodeId(String nodeId);

    /**
     * Unconditionally writes the status, error message and token totals.
     */
    Execution updateStatus(String executionId, ExecutionStatus status, String errorMessage, TokenTotals tokens);

    /**
     * Marks the execution failed by a fault and bumps its fault count. A
     * retryable fault leaves the execution claimable by a redelivered job.
     * Ignored when the execution is already cancelled or complete.
     */
    Execution recordFault(String executionId, String errorMessage, TokenTotals tokens, boolean retryable);

    void updateModel(String executionId, String modelId);

    /**
     * Writes {@code target} only if the current status is one of
     * {@code expected}. A {@code failed} execution only matches when its fault
     * is retryable.
     *
     * @return the updated execution, or empty when the status did not match
     */
    Optional<Execution> compareAndSetStatus(String executionId, Set<ExecutionStatus> expected,
            ExecutionStatus target);

    /**
     * Stores a human answer in the checkpoint's {@code humanInputResponse} and
     * moves the execution from {@code awaiting_input} to {@code running}.
     *
     * @return the updated execution, or empty when it was not awaiting input
     */
    Optional<Execution> submitHumanInput(String executionId, JsonNode response);
}
