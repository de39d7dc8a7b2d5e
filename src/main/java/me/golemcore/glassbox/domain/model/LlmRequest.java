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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Request sent to the LLM gateway: the full transcript (system turn first), the
 * tool schema, and per-call model selection and credentials.
 */
@Data
@Builder
public class LlmRequest {

    /**
     * Model id in {@code provider/model} form; an unprefixed id is treated as
     * OpenAI-compatible.
     */
    private String model;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    @Builder.Default
    private ToolChoiceMode toolChoice = ToolChoiceMode.AUTO;

    private Double temperature;

    private Integer maxTokens;

    /**
     * Overrides of the configured provider credentials, usually from the job's
     * org config.
     */
    private String apiKey;
    private String apiBase;

    private String executionId;

    public enum ToolChoiceMode {
        AUTO, REQUIRED
    }
}
