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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Everything lives under one workspace directory:
 * <ul>
 * <li>executions/ - execution documents with their checkpoints
 * <li>trace/ - trace events (JSONL, one file per execution)
 * <li>nodes/ - nodes and their inputs
 * <li>files/ - file records
 * <li>outputs/ - node output records
 * <li>blobs/ - blob store objects and their metadata sidecars
 * </ul>
 *
 * <p>
 * Base path configured via {@code glassbox.storage.local.base-path}, defaults
 * to {@code ${user.home}/.glassbox/workspace}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> KNOWN_DIRECTORIES = List.of("executions", "trace", "nodes", "files", "outputs",
            "blobs");

    private final AgentProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : KNOWN_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage directory: " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> putObject(String directory, String path, byte[] content) {
        return CompletableFuture.runAsync(() -> {
            Path filePath = resolvePath(directory, path);
            try {
                createParent(filePath);
                Files.write(filePath, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return putObject(directory, path, content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<byte[]> getObject(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(directory, path);
            if (!Files.exists(filePath)) {
                return null;
            }
            try {
                return Files.readAllBytes(filePath);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return getObject(directory, path)
                .thenApply(bytes -> bytes == null ? null : new String(bytes, StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolvePath(directory, "");
            Path start = prefix != null && !prefix.isEmpty() ? resolvePath(directory, prefix) : dirPath;
            if (!Files.exists(start)) {
                return Collections.emptyList();
            }
            try (Stream<Path> paths = Files.walk(start)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> dirPath.relativize(p).toString().replace('\\', '/'))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path filePath = resolvePath(directory, path);
            try {
                createParent(filePath);
                try (FileChannel channel = FileChannel.open(filePath, StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    channel.write(StandardCharsets.UTF_8.encode(content));
                    channel.force(false);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to file: " + directory + "/" + path, e);
            }
        });
    }

    /**
     * Writes to a temp file in the target directory, fsyncs it and renames it
     * over the target, so readers see either the old or the new content.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = null;
            try {
                createParent(targetPath);
                tempPath = Files.createTempFile(targetPath.getParent(), targetPath.getFileName().toString(), ".tmp");

                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING)) {
                    channel.write(ByteBuffer.wrap(bytes));
                    channel.force(true);
                }

                try {
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                deleteQuietly(tempPath);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    Path getBasePath() {
        return basePath;
    }

    private void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private void deleteQuietly(Path tempPath) {
        if (tempPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
