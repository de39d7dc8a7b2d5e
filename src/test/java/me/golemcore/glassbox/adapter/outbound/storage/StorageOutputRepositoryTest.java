package me.golemcore.glassbox.adapter.outbound.storage;

import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.domain.model.NodeOutput;
import me.golemcore.glassbox.domain.model.OutputType;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.infrastructure.config.AutoConfiguration;
import me.golemcore.glassbox.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class StorageOutputRepositoryTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private StorageOutputRepository repository;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        repository = new StorageOutputRepository(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldRecordFileAndOutput() {
        repository.record(file("file-1"), output("out-1", "file-1", Instant.parse("2026-03-01T10:00:00Z")));

        FileRecord file = repository.findFile("file-1").orElseThrow();
        assertEquals("outputs/org-1/exec-1/k.txt", file.getStorageKey());
        assertEquals("agent_output", file.getMetadata().get("source"));
        List<NodeOutput> outputs = repository.findOutputs("node-1");
        assertEquals(1, outputs.size());
        assertEquals(OutputType.TEXT, outputs.get(0).getOutputType());
        assertEquals("file-1", outputs.get(0).getFileId());
    }

    @Test
    void shouldListOutputsOldestFirst() {
        repository.record(file("file-2"), output("out-2", "file-2", Instant.parse("2026-03-01T10:00:05Z")));
        repository.record(file("file-1"), output("out-1", "file-1", Instant.parse("2026-03-01T10:00:01Z")));

        List<String> ids = repository.findOutputs("node-1").stream().map(NodeOutput::getId).toList();

        assertEquals(List.of("out-1", "out-2"), ids);
    }

    @Test
    void shouldRemoveFileRecordWhenOutputWriteFails() {
        StoragePort failing = spy(storage);
        doReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")))
                .when(failing).putTextAtomic(eq("outputs"), anyString(), anyString());
        StorageOutputRepository failingRepository = new StorageOutputRepository(failing,
                AutoConfiguration.objectMapper());

        assertThrows(RuntimeException.class,
                () -> failingRepository.record(file("file-1"), output("out-1", "file-1", Instant.now())));

        assertTrue(repository.findFile("file-1").isEmpty());
        assertTrue(repository.findOutputs("node-1").isEmpty());
    }

    private static FileRecord file(String id) {
        return FileRecord.builder()
                .id(id)
                .orgId("org-1")
                .storageKey("outputs/org-1/exec-1/k.txt")
                .contentType("text/plain")
                .sizeBytes(5)
                .processingStatus(FileRecord.PROCESSING_COMPLETE)
                .metadata(Map.of("source", "agent_output"))
                .build();
    }

    private static NodeOutput output(String id, String fileId, Instant createdAt) {
        return NodeOutput.builder()
                .id(id)
                .nodeId("node-1")
                .outputType(OutputType.TEXT)
                .fileId(fileId)
                .label("text")
                .createdAt(createdAt)
                .build();
    }
}
