package me.golemcore.glassbox.adapter.outbound.storage;

import me.golemcore.glassbox.domain.model.AuthorType;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.NodeInput;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageNodeRepositoryTest {

    @TempDir
    Path tempDir;

    private StorageNodeRepository repository;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        repository = new StorageNodeRepository(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldSaveAndFindNode() {
        repository.save(Node.builder().id("node-1").orgId("org-1").title("Plan").authorType(AuthorType.AGENT)
                .build());

        Node loaded = repository.findById("node-1").orElseThrow();

        assertEquals("org-1", loaded.getOrgId());
        assertEquals(AuthorType.AGENT, loaded.getAuthorType());
        assertTrue(repository.findById("node-2").isEmpty());
    }

    @Test
    void shouldReturnInputsInSortOrder() {
        repository.saveInput(NodeInput.builder().id("b").nodeId("node-1").inputType(NodeInput.TYPE_TEXT)
                .sortOrder(2).build());
        repository.saveInput(NodeInput.builder().id("a").nodeId("node-1").inputType(NodeInput.TYPE_TEXT)
                .sortOrder(1).build());
        repository.saveInput(NodeInput.builder().id("c").nodeId("node-2").inputType(NodeInput.TYPE_TEXT)
                .sortOrder(0).build());

        List<String> ids = repository.findInputs("node-1").stream().map(NodeInput::getId).toList();

        assertEquals(List.of("a", "b"), ids);
    }

    @Test
    void shouldFindChildrenOldestFirst() {
        repository.save(Node.builder().id("parent").build());
        repository.save(Node.builder().id("child-2").parentId("parent")
                .createdAt(Instant.parse("2026-03-01T10:00:02Z")).build());
        repository.save(Node.builder().id("child-1").parentId("parent")
                .createdAt(Instant.parse("2026-03-01T10:00:01Z")).build());
        repository.save(Node.builder().id("other").parentId("someone-else").build());
        repository.saveInput(NodeInput.builder().id("in-1").nodeId("parent").build());

        List<String> ids = repository.findChildren("parent").stream().map(Node::getId).toList();

        assertEquals(List.of("child-1", "child-2"), ids);
    }
}
