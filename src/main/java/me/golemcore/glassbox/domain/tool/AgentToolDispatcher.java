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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.exception.InvalidToolArgumentException;
import me.golemcore.glassbox.domain.exception.UnknownToolException;
import me.golemcore.glassbox.domain.model.Message;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.domain.service.TraceRecorder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Executes one model tool call against the current execution.
 *
 * <p>
 * Order per call: parse arguments (malformed JSON fails the iteration), record
 * a {@code tool_call} trace event, decode into a {@link ToolInvocation}, run
 * the matching tool. Unknown tools and contract violations come back as tool
 * output so the model can correct itself; faults raised by the tool itself
 * propagate.
 */
@Component
@Slf4j
public class AgentToolDispatcher {

    private final AgentToolCatalog catalog;
    private final ToolInvocationDecoder decoder;
    private final TraceRecorder traceRecorder;
    private final ObjectMapper objectMapper;

    public AgentToolDispatcher(AgentToolCatalog catalog, ToolInvocationDecoder decoder,
            TraceRecorder traceRecorder, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.decoder = decoder;
        this.traceRecorder = traceRecorder;
        this.objectMapper = objectMapper;
    }

    public ToolExecutionOutcome dispatch(ToolContext context, Message.ToolCall toolCall) {
        JsonNode arguments = decoder.parseArguments(toolCall);
        recordToolCall(context.executionId(), toolCall, arguments);
        log.info("[Tools] Executing {} (call {})", toolCall.getName(), toolCall.getId());

        ToolInvocation invocation;
        try {
            invocation = decoder.decode(toolCall.getName(), arguments);
        } catch (UnknownToolException e) {
            log.warn("[Tools] Model requested unknown tool: {}", toolCall.getName());
            return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(),
                    ToolResult.failure(e.getMessage()), e.getMessage(), false);
        } catch (InvalidToolArgumentException e) {
            log.warn("[Tools] Invalid arguments for {}: {}", toolCall.getName(), e.getMessage());
            return ToolExecutionOutcome.of(toolCall, ToolResult.failure(e.getMessage()));
        }

        ToolResult result = await(execute(context, invocation));
        if (!result.isSuccess()) {
            log.warn("[Tools] {} failed: {}", toolCall.getName(), result.getError());
        }
        return ToolExecutionOutcome.of(toolCall, result);
    }

    private CompletableFuture<ToolResult> execute(ToolContext context, ToolInvocation invocation) {
        if (invocation instanceof ToolInvocation.CreateSubnode createSubnode) {
            return catalog.createSubnode().execute(context, createSubnode);
        }
        if (invocation instanceof ToolInvocation.AddOutput addOutput) {
            return catalog.addOutput().execute(context, addOutput);
        }
        if (invocation instanceof ToolInvocation.RequestHumanInput requestHumanInput) {
            return catalog.requestHumanInput().execute(context, requestHumanInput);
        }
        if (invocation instanceof ToolInvocation.MarkComplete markComplete) {
            return catalog.markComplete().execute(context, markComplete);
        }
        throw new IllegalStateException("Unhandled tool invocation: " + invocation.getClass().getName());
    }

    private ToolResult await(CompletableFuture<ToolResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private void recordToolCall(String executionId, Message.ToolCall toolCall, JsonNode arguments) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolCall.getName());
        payload.put("tool_call_id", toolCall.getId());
        payload.put("arguments", objectMapper.convertValue(arguments, Map.class));
        traceRecorder.record(executionId, TraceEventType.TOOL_CALL, payload);
    }
}
