package me.golemcore.glassbox.tools;

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

import me.golemcore.glassbox.domain.component.AgentTool;
import me.golemcore.glassbox.domain.model.HumanInputRequest;
import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.domain.service.TraceRecorder;
import me.golemcore.glassbox.domain.tool.ToolContext;
import me.golemcore.glassbox.domain.tool.ToolSchemas;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Records a question for the human supervisor. The execution status is left to
 * the engine, which suspends the run once the tool batch is processed.
 */
@Component
public class RequestHumanInputTool implements AgentTool<ToolInvocation.RequestHumanInput> {

    static final String RESULT = "Human input requested. Execution will pause until input is provided.";

    private final TraceRecorder traceRecorder;

    public RequestHumanInputTool(TraceRecorder traceRecorder) {
        this.traceRecorder = traceRecorder;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolInvocation.REQUEST_HUMAN_INPUT)
                .description("Request input or clarification from the human supervisor")
                .inputSchema(ToolSchemas.object(
                        ToolSchemas.properties(
                                "question", ToolSchemas.string("The question to ask"),
                                "options", ToolSchemas.stringArray("Optional list of suggested answers")),
                        List.of("question")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, ToolInvocation.RequestHumanInput invocation) {
        context.state().requestHumanInput(HumanInputRequest.question(invocation.question(), invocation.options()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", invocation.question());
        payload.put("options", invocation.options());
        traceRecorder.record(context.executionId(), TraceEventType.HUMAN_INPUT_REQUESTED, payload);

        return CompletableFuture.completedFuture(ToolResult.success(RESULT));
    }
}
