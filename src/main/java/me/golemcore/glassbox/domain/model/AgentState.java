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
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Working memory of one execution. Everything except the transient flags is
 * persisted as the checkpoint payload and restored verbatim on resume.
 *
 * <p>
 * The transcript only grows while an engine instance owns the state. External
 * actors never touch this object directly: a human answer arrives through the
 * {@code humanInputResponse} field of the stored checkpoint and is merged by the
 * engine at an iteration boundary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentState {

    public static final String STEP_START = "start";
    public static final String STEP_COMPLETE = "complete";

    @Builder.Default
    private List<Message> messages = new ArrayList<>();
    private int iteration;
    @Builder.Default
    private List<OutputDescriptor> outputs = new ArrayList<>();
    @Builder.Default
    private List<String> subNodesCreated = new ArrayList<>();
    @Builder.Default
    private String currentStep = STEP_START;
    private HumanInputRequest humanInputRequest;
    private JsonNode humanInputResponse;

    @JsonIgnore
    private boolean humanInputNeeded;
    @JsonIgnore
    private String completionSummary;

    public void addMessage(Message message) {
        messages.add(message);
    }

    public void addOutput(OutputDescriptor output) {
        outputs.add(output);
    }

    public void addSubNode(String nodeId) {
        subNodesCreated.add(nodeId);
    }

    @JsonIgnore
    public boolean isComplete() {
        return STEP_COMPLETE.equals(currentStep);
    }

    public void markComplete(String summary) {
        this.currentStep = STEP_COMPLETE;
        this.completionSummary = summary;
    }

    public void requestHumanInput(HumanInputRequest request) {
        this.humanInputRequest = request;
        this.humanInputNeeded = true;
    }

    public boolean hasHumanInputResponse() {
        return humanInputResponse != null && !humanInputResponse.isNull() && !humanInputResponse.isMissingNode();
    }

    /**
     * Takes the pending human response out of the state together with the request
     * it answered, so that it is applied at most once.
     */
    public JsonNode consumeHumanInputResponse() {
        JsonNode response = humanInputResponse;
        this.humanInputResponse = null;
        this.humanInputRequest = null;
        this.humanInputNeeded = false;
        return response;
    }

    public int incrementIteration() {
        return ++iteration;
    }
}
