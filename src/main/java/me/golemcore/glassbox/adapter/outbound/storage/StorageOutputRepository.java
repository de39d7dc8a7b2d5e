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
import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.domain.model.NodeOutput;
import me.golemcore.glassbox.port.outbound.OutputPort;
import me.golemcore.glassbox.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * File records under {@code files/<id>.json} and node outputs under
 * {@code outputs/<nodeId>/<outputId>.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageOutputRepository implements OutputPort {

    private static final String FILES_DIR = "files";
    private static final String OUTPUTS_DIR = "outputs";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    /**
     * The file record is removed again when the output record cannot be written,
     * so a failed call leaves neither behind.
     */
    @Override
    public void record(FileRecord file, NodeOutput output) {
        saveFile(file);
        try {
            writeJson(OUTPUTS_DIR, outputPath(output), output);
        } catch (RuntimeException e) {
            storagePort.deleteObject(FILES_DIR, file.getId() + JSON_EXTENSION).join();
            throw e;
        }
        log.debug("[Storage] Recorded output {} (file {}) for node {}", output.getId(), file.getId(),
                output.getNodeId());
    }

    @Override
    public void saveFile(FileRecord file) {
        writeJson(FILES_DIR, file.getId() + JSON_EXTENSION, file);
    }

    @Override
    public Optional<FileRecord> findFile(String fileId) {
        return readJson(FILES_DIR, fileId + JSON_EXTENSION, FileRecord.class);
    }

    @Override
    public List<NodeOutput> findOutputs(String nodeId) {
        List<NodeOutput> outputs = new ArrayList<>();
        for (String file : storagePort.listObjects(OUTPUTS_DIR, nodeId + "/").join()) {
            readJson(OUTPUTS_DIR, file, NodeOutput.class).ifPresent(outputs::add);
        }
        outputs.sort(Comparator.comparing(NodeOutput::getCreatedAt,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return outputs;
    }

    private String outputPath(NodeOutput output) {
        return output.getNodeId() + "/" + output.getId() + JSON_EXTENSION;
    }

    private <T> Optional<T> readJson(String directory, String path, Class<T> type) {
        String json = storagePort.getText(directory, path).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted document: " + directory + "/" + path, e);
        }
    }

    private void writeJson(String directory, String path, Object value) {
        try {
            storagePort.putTextAtomic(directory, path, objectMapper.writeValueAsString(value)).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document: " + directory + "/" + path, e);
        }
    }
}
