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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.glassbox.domain.model.AgentState;
import org.springframework.stereotype.Service;

/**
 * Converts {@link AgentState} to and from the checkpoint payload. Only the
 * persistent fields are written: {@code messages}, {@code iteration},
 * {@code outputs}, {@code subNodesCreated}, {@code currentStep},
 * {@code humanInputRequest} and {@code humanInputResponse}.
 */
@Service
@RequiredArgsConstructor
public class CheckpointSerializer {

    private final ObjectMapper objectMapper;

    public String serialize(AgentState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize agent state", e);
        }
    }

    public AgentState deserialize(String payload) {
        try {
            AgentState state = objectMapper.readValue(payload, AgentState.class);
            normalize(state);
            return state;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Checkpoint payload is not a valid agent state", e);
        }
    }

    // Explicit JSON nulls in older payloads would otherwise replace the builder
    // defaults.
    private void normalize(AgentState state) {
        AgentState defaults = AgentState.builder().build();
        if (state.getMessages() == null) {
            state.setMessages(defaults.getMessages());
        }
        if (state.getOutputs() == null) {
            state.setOutputs(defaults.getOutputs());
        }
        if (state.getSubNodesCreated() == null) {
            state.setSubNodesCreated(defaults.getSubNodesCreated());
        }
        if (state.getCurrentStep() == null) {
            state.setCurrentStep(AgentState.STEP_START);
        }
        if (state.getHumanInputResponse() != null && state.getHumanInputResponse().isNull()) {
            state.setHumanInputResponse(null);
        }
    }
}
