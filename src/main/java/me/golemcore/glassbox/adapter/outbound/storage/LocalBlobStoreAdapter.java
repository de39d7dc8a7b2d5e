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
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.BlobStorePort;
import me.golemcore.glassbox.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

/**
 * Blob store on top of the workspace storage. Each object {@code blobs/<key>}
 * gets a {@code blobs/<key>.meta.json} sidecar with its content type, size and
 * caller metadata.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalBlobStoreAdapter implements BlobStorePort {

    private static final String BLOBS_DIR = "blobs";
    private static final String META_SUFFIX = ".meta.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;

    @Override
    public CompletableFuture<String> upload(byte[] content, String key, String contentType,
            Map<String, String> metadata) {
        Map<String, Object> sidecar = new LinkedHashMap<>();
        sidecar.put("bucket", getBucket());
        sidecar.put("key", key);
        sidecar.put("content_type", contentType);
        sidecar.put("size_bytes", content.length);
        sidecar.put("metadata", metadata != null ? metadata : Map.of());

        String sidecarJson;
        try {
            sidecarJson = objectMapper.writeValueAsString(sidecar);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        return storagePort.putObject(BLOBS_DIR, key, content)
                .thenCompose(ignored -> storagePort.putTextAtomic(BLOBS_DIR, key + META_SUFFIX, sidecarJson))
                .thenApply(ignored -> {
                    log.debug("[Storage] Uploaded blob {} ({} bytes)", key, content.length);
                    return key;
                });
    }

    @Override
    public CompletableFuture<byte[]> download(String key) {
        return storagePort.getObject(BLOBS_DIR, key).thenApply(bytes -> {
            if (bytes == null) {
                throw new NoSuchElementException("Blob not found: " + key);
            }
            return bytes;
        });
    }

    @Override
    public String getBucket() {
        return properties.getStorage().getBucket();
    }
}
