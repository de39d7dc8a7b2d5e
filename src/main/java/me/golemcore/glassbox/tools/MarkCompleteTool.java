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
import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.tool.ToolContext;
import me.golemcore.glassbox.domain.tool.ToolSchemas;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Completion signal. Only flips the agent state; the engine writes the status.
 */
@Component
public class MarkCompleteTool implements AgentTool<ToolInvocation.MarkComplete> {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolInvocation.MARK_COMPLETE)
                .description("Mark this node as complete")
                .inputSchema(ToolSchemas.object(
                        ToolSchemas.properties(
                                "summary", ToolSchemas.string("Brief summary of what was accomplished")),
                        List.of("summary")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, ToolInvocation.MarkComplete invocation) {
        context.state().markComplete(invocation.summary());
        return CompletableFuture.completedFuture(
                ToolResult.success("Node marked as complete: " + invocation.summary()));
    }
}
