package me.golemcore.glassbox.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One attempt to run the agent against a node, together with its checkpoint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Execution {

    private String id;
    private String nodeId;
    private ExecutionStatus status;
    private String modelId;
    private long totalTokensIn;
    private long totalTokensOut;
    private String errorMessage;

    /**
     * Set when the last failure was a fault that a redelivered job may resume
     * from the checkpoint. Cleared on every other status write.
     */
    private boolean retryable;
    private int faultCount;

    /**
     * Serialized {@link AgentState}, or {@code null} before the first save.
     */
    private JsonNode checkpoint;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    @JsonIgnore
    public TokenTotals getTokenTotals() {
        return new TokenTotals(totalTokensIn, totalTokensOut);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isResumableAfterFault() {
        return status == ExecutionStatus.FAILED && retryable;
    }
}
