package me.golemcore.glassbox.domain.tool;

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
import me.golemcore.glassbox.domain.model.AgentState;
import me.golemcore.glassbox.domain.model.LlmResponse;
import me.golemcore.glassbox.domain.model.Message;
import org.springframework.stereotype.Component;

/**
 * Appends turns to the agent transcript.
 */
@Component
public class TranscriptWriter {

    static final String HUMAN_RESPONSE_PREFIX = "Human response: ";

    public void appendOpening(AgentState state, String systemPrompt, String kickoff) {
        state.addMessage(Message.system(systemPrompt));
        state.addMessage(Message.user(kickoff));
    }

    public Message appendAssistantTurn(AgentState state, LlmResponse response) {
        Message assistant = Message.assistant(response.getContent(), response.getToolCalls());
        state.addMessage(assistant);
        return assistant;
    }

    public void appendToolResult(AgentState state, ToolExecutionOutcome outcome) {
        state.addMessage(Message.toolResult(outcome.toolCallId(), outcome.toolName(), outcome.messageContent()));
    }

    /**
     * Human answers are passed on as their JSON text, so a plain string arrives
     * quoted.
     */
    public void appendHumanResponse(AgentState state, JsonNode response) {
        state.addMessage(Message.user(HUMAN_RESPONSE_PREFIX + response.toString()));
    }
}
