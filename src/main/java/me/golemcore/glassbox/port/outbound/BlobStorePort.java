package me.golemcore.glassbox.port.outbound;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Durable store for output and input bytes.
 */
public interface BlobStorePort {

    /**
     * @return the key the content was stored under
     */
    CompletableFuture<String> upload(byte[] content, String key, String contentType, Map<String, String> metadata);

    /**
     * Fails with {@link java.util.NoSuchElementException} when the key is absent.
     */
    CompletableFuture<byte[]> download(String key);

    String getBucket();
}
