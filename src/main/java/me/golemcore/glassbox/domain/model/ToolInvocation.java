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

import java.util.List;

/**
 * Closed set of capabilities the model may invoke, each with its typed
 * arguments. Produced by decoding a {@link Message.ToolCall}.
 */
public sealed interface ToolInvocation
        permits ToolInvocation.CreateSubnode, ToolInvocation.AddOutput,
        ToolInvocation.RequestHumanInput, ToolInvocation.MarkComplete {

    String CREATE_SUBNODE = "create_subnode";
    String ADD_OUTPUT = "add_output";
    String REQUEST_HUMAN_INPUT = "request_human_input";
    String MARK_COMPLETE = "mark_complete";

    String toolName();

    record CreateSubnode(String title, String description, AuthorType authorType) implements ToolInvocation {
        @Override
        public String toolName() {
            return CREATE_SUBNODE;
        }
    }

    record AddOutput(OutputType type, String content, String label) implements ToolInvocation {
        @Override
        public String toolName() {
            return ADD_OUTPUT;
        }

        public String effectiveLabel() {
            return label != null && !label.isBlank() ? label : type.getValue();
        }
    }

    record RequestHumanInput(String question, List<String> options) implements ToolInvocation {
        public RequestHumanInput {
            options = options != null ? List.copyOf(options) : List.of();
        }

        @Override
        public String toolName() {
            return REQUEST_HUMAN_INPUT;
        }
    }

    record MarkComplete(String summary) implements ToolInvocation {
        @Override
        public String toolName() {
            return MARK_COMPLETE;
        }
    }
}
