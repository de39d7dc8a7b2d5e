package me.golemcore.glassbox.domain.component;

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

import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.tool.ToolContext;

import java.util.concurrent.CompletableFuture;

/**
 * One of the capabilities offered to the model.
 *
 * @param <I>
 *            the invocation variant this tool executes
 */
public interface AgentTool<I extends ToolInvocation> {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes a decoded invocation against the current execution. Side effects
     * on the agent state go through {@link ToolContext#state()}.
     *
     * @param context
     *            the execution the call belongs to
     * @param invocation
     *            typed arguments
     * @return a future containing the tool result; completes exceptionally on
     *         infrastructure faults
     */
    CompletableFuture<ToolResult> execute(ToolContext context, I invocation);

    default String getToolName() {
        return getDefinition().getName();
    }
}
