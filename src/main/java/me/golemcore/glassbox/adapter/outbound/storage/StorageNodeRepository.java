package me.golemcore.glassbox.adapter.outbound.storage;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.NodeInput;
import me.golemcore.glassbox.port.outbound.NodePort;
import me.golemcore.glassbox.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Nodes under {@code nodes/<id>.json}, their inputs under
 * {@code nodes/<id>/inputs/<inputId>.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageNodeRepository implements NodePort {

    private static final String NODES_DIR = "nodes";
    private static final String JSON_EXTENSION = ".json";
    private static final String INPUTS_SEGMENT = "/inputs/";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Node> findById(String nodeId) {
        return readJson(nodeId + JSON_EXTENSION, Node.class);
    }

    @Override
    public List<NodeInput> findInputs(String nodeId) {
        List<NodeInput> inputs = new ArrayList<>();
        for (String file : storagePort.listObjects(NODES_DIR, nodeId + INPUTS_SEGMENT).join()) {
            readJson(file, NodeInput.class).ifPresent(inputs::add);
        }
        inputs.sort(Comparator.comparingInt(NodeInput::getSortOrder));
        return inputs;
    }

    @Override
    public List<Node> findChildren(String parentId) {
        List<Node> children = new ArrayList<>();
        for (String file : storagePort.listObjects(NODES_DIR, "").join()) {
            if (file.contains("/") || !file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            readJson(file, Node.class)
                    .filter(node -> parentId.equals(node.getParentId()))
                    .ifPresent(children::add);
        }
        children.sort(Comparator.comparing(Node::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return children;
    }

    @Override
    public void save(Node node) {
        writeJson(node.getId() + JSON_EXTENSION, node);
        log.debug("[Storage] Saved node {}", node.getId());
    }

    @Override
    public void saveInput(NodeInput input) {
        writeJson(input.getNodeId() + INPUTS_SEGMENT + input.getId() + JSON_EXTENSION, input);
    }

    private <T> Optional<T> readJson(String path, Class<T> type) {
        String json = storagePort.getText(NODES_DIR, path).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted node document: " + path, e);
        }
    }

    private void writeJson(String path, Object value) {
        try {
            storagePort.putTextAtomic(NODES_DIR, path, objectMapper.writeValueAsString(value)).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize node document: " + path, e);
        }
    }
}
