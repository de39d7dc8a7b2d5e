package me.golemcore.glassbox.adapter.outbound.extraction;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.port.outbound.BlobStorePort;
import me.golemcore.glassbox.port.outbound.TextExtractionPort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Extracts text from plain-text blobs ({@code text/*}, JSON, XML). Binary
 * formats yield {@code null}; document and OCR extraction belong to the
 * ingestion pipeline, which stores its result on the file record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlainTextExtractionAdapter implements TextExtractionPort {

    private static final Set<String> TEXTUAL_APPLICATION_TYPES = Set.of(
            "application/json", "application/xml", "application/x-yaml", "application/yaml");

    private final BlobStorePort blobStorePort;

    @Override
    public CompletableFuture<String> extractText(FileRecord file) {
        if (file == null || file.getStorageKey() == null || !isTextual(file.getContentType())) {
            return CompletableFuture.completedFuture(null);
        }
        return blobStorePort.download(file.getStorageKey())
                .thenApply(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .exceptionally(e -> {
                    log.warn("[Extraction] Failed to read {}: {}", file.getStorageKey(), e.getMessage());
                    return null;
                });
    }

    static boolean isTextual(String contentType) {
        if (contentType == null) {
            return false;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        int params = type.indexOf(';');
        if (params >= 0) {
            type = type.substring(0, params).trim();
        }
        return type.startsWith("text/") || TEXTUAL_APPLICATION_TYPES.contains(type);
    }
}
