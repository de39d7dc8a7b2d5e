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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.component.AgentTool;
import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.domain.model.NodeOutput;
import me.golemcore.glassbox.domain.model.OutputDescriptor;
import me.golemcore.glassbox.domain.model.OutputType;
import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import me.golemcore.glassbox.domain.model.ToolResult;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.domain.service.OutputKeyGenerator;
import me.golemcore.glassbox.domain.service.TraceRecorder;
import me.golemcore.glassbox.domain.tool.ToolContext;
import me.golemcore.glassbox.domain.tool.ToolSchemas;
import me.golemcore.glassbox.port.outbound.BlobStorePort;
import me.golemcore.glassbox.port.outbound.OutputPort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Stores an artifact for the current node.
 *
 * <p>
 * Every output goes to blob storage, whatever its type; the file record and the
 * node output are written only after the upload succeeded. {@code
 * structured_data} content must parse as JSON and is stored re-serialized in
 * compact form. Validation happens before any side effect.
 */
@Component
@Slf4j
public class AddOutputTool implements AgentTool<ToolInvocation.AddOutput> {

    static final String SOURCE_AGENT_OUTPUT = "agent_output";

    private final BlobStorePort blobStorePort;
    private final OutputPort outputPort;
    private final OutputKeyGenerator keyGenerator;
    private final TraceRecorder traceRecorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AddOutputTool(BlobStorePort blobStorePort, OutputPort outputPort, OutputKeyGenerator keyGenerator,
            TraceRecorder traceRecorder, ObjectMapper objectMapper, Clock clock) {
        this.blobStorePort = blobStorePort;
        this.outputPort = outputPort;
        this.keyGenerator = keyGenerator;
        this.traceRecorder = traceRecorder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolInvocation.ADD_OUTPUT)
                .description("Add an output to this node")
                .inputSchema(ToolSchemas.object(
                        ToolSchemas.properties(
                                "type", ToolSchemas.enumString(OutputType.wireValues(), "Type of output"),
                                "content", ToolSchemas.string("The output content (text or JSON string)"),
                                "label", ToolSchemas.string("Label for the output")),
                        List.of("type", "content")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, ToolInvocation.AddOutput invocation) {
        OutputType type = invocation.type();
        String content = invocation.content();
        if (type == OutputType.STRUCTURED_DATA) {
            try {
                content = objectMapper.writeValueAsString(objectMapper.readTree(content));
            } catch (JsonProcessingException e) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure("structured_data content is not valid JSON: " + e.getOriginalMessage()));
            }
        }
        if (context.orgId() == null || context.orgId().isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Node " + context.nodeId() + " has no organization"));
        }

        String label = invocation.effectiveLabel();
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String storageKey = keyGenerator.generate(context.orgId(), context.executionId(), type);

        Map<String, String> blobMetadata = new LinkedHashMap<>();
        blobMetadata.put("execution_id", context.executionId());
        blobMetadata.put("node_id", context.nodeId());
        blobMetadata.put("output_type", type.getValue());
        blobMetadata.put("label", label);

        return blobStorePort.upload(bytes, storageKey, type.getContentType(), blobMetadata)
                .thenApply(key -> record(context, invocation, label, key, bytes.length));
    }

    private ToolResult record(ToolContext context, ToolInvocation.AddOutput invocation, String label,
            String storageKey, long sizeBytes) {
        OutputType type = invocation.type();
        String fileId = UUID.randomUUID().toString();
        String outputId = UUID.randomUUID().toString();

        Map<String, Object> fileMetadata = new LinkedHashMap<>();
        fileMetadata.put("source", SOURCE_AGENT_OUTPUT);
        fileMetadata.put("execution_id", context.executionId());
        fileMetadata.put("node_id", context.nodeId());
        fileMetadata.put("output_type", type.getValue());

        FileRecord file = FileRecord.builder()
                .id(fileId)
                .orgId(context.orgId())
                .storageKey(storageKey)
                .storageBucket(blobStorePort.getBucket())
                .filename(label + "." + type.getExtension())
                .contentType(type.getContentType())
                .sizeBytes(sizeBytes)
                .processingStatus(FileRecord.PROCESSING_COMPLETE)
                .metadata(fileMetadata)
                .createdAt(clock.instant())
                .build();

        Map<String, Object> outputMetadata = new LinkedHashMap<>();
        outputMetadata.put("storage_key", storageKey);
        NodeOutput output = NodeOutput.builder()
                .id(outputId)
                .nodeId(context.nodeId())
                .outputType(type)
                .fileId(fileId)
                .label(label)
                .metadata(outputMetadata)
                .createdAt(clock.instant())
                .build();

        outputPort.record(file, output);
        context.state().addOutput(OutputDescriptor.builder()
                .id(outputId)
                .fileId(fileId)
                .storageKey(storageKey)
                .type(type)
                .label(label)
                .sizeBytes(sizeBytes)
                .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("output_id", outputId);
        payload.put("file_id", fileId);
        payload.put("storage_key", storageKey);
        payload.put("size_bytes", sizeBytes);
        payload.put("type", type.getValue());
        payload.put("label", label);
        traceRecorder.record(context.executionId(), TraceEventType.OUTPUT_ADDED, payload);

        log.info("[Tools] Output {} stored at {} ({} bytes)", outputId, storageKey, sizeBytes);
        return ToolResult.success("Added output: " + label + " (stored in blob storage)");
    }
}
