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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Directory-scoped object storage used by the local repositories and the blob
 * store.
 */
public interface StoragePort {

    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    CompletableFuture<Void> putText(String directory, String path, String content);

    CompletableFuture<byte[]> getObject(String directory, String path);

    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    CompletableFuture<Void> appendText(String directory, String path, String content);

    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
