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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A single turn of the agent transcript. Assistant turns may carry tool calls;
 * tool turns carry the id of the call they answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private MessageRole role;
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool result turns
    private String toolName; // Tool name for tool result turns

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                .build();
    }

    public static Message toolResult(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(MessageRole.TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * A tool invocation requested by the model. Arguments are kept as the raw
     * JSON string the provider returned so that decoding failures surface at
     * dispatch time.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private String arguments;
    }
}
