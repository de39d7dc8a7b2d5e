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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.component.AgentTool;
import me.golemcore.glassbox.domain.model.AuthorType;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.domain.service.TraceRecorder;
import me.golemcore.glassbox.domain.tool.ToolContext;
import me.golemcore.glassbox.domain.tool.ToolSchemas;
import me.golemcore.glassbox.port.outbound.NodePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Decomposes the current node: creates a draft child node in the same
 * organization and project.
 */
@Component
@Slf4j
public class CreateSubnodeTool implements AgentTool<ToolInvocation.CreateSubnode> {

    private final NodePort nodePort;
    private final TraceRecorder traceRecorder;
    private final Clock clock;

    public CreateSubnodeTool(NodePort nodePort, TraceRecorder traceRecorder, Clock clock) {
        this.nodePort = nodePort;
        this.traceRecorder = traceRecorder;
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolInvocation.CREATE_SUBNODE)
                .description("Create a sub-node to decompose this task into smaller parts")
                .inputSchema(ToolSchemas.object(
                        ToolSchemas.properties(
                                "title", ToolSchemas.string("Title of the sub-node"),
                                "description", ToolSchemas.string("Description of what this sub-node should accomplish"),
                                "author_type", ToolSchemas.enumString(AuthorType.wireValues(),
                                        "Whether this should be done by an agent or assigned to a human")),
                        List.of("title", "author_type")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, ToolInvocation.CreateSubnode invocation) {
        Node parent = context.node();
        Node child = Node.builder()
                .id(UUID.randomUUID().toString())
                .orgId(parent.getOrgId())
                .projectId(parent.getProjectId())
                .parentId(parent.getId())
                .title(invocation.title())
                .description(invocation.description())
                .authorType(invocation.authorType())
                .status(Node.STATUS_DRAFT)
                .createdAt(clock.instant())
                .build();
        nodePort.save(child);
        context.state().addSubNode(child.getId());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subnode_id", child.getId());
        payload.put("title", invocation.title());
        payload.put("description", invocation.description());
        payload.put("author_type", invocation.authorType().getValue());
        traceRecorder.record(context.executionId(), TraceEventType.SUBNODE_CREATED, payload);

        log.info("[Tools] Created sub-node {} under {}", child.getId(), parent.getId());
        return CompletableFuture.completedFuture(
                ToolResult.success("Created sub-node: " + invocation.title() + " (id: " + child.getId() + ")"));
    }
}
