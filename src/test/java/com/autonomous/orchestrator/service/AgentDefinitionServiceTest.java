package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.InvalidTaskArgumentException;
import com.autonomous.orchestrator.model.AgentDefinition;
import com.autonomous.orchestrator.model.AgentTask;
import com.autonomous.orchestrator.model.AgentTaskPriority;
import com.autonomous.orchestrator.model.AgentTaskStatus;
import com.autonomous.orchestrator.model.AgentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AgentDefinitionServiceTest {

    private AgentDefinitionService definitionService;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        definitionService = new AgentDefinitionService();
        definitionService.setConfigPath(tempDir.toString());
    }

    private void writeFile(String name, String... lines) throws Exception {
        File file = tempDir.resolve(name).toFile();
        try (FileWriter writer = new FileWriter(file)) {
            for (String line : lines) {
                writer.write(line + "\n");
            }
        }
    }

    @Test
    void shouldLoadDefinitionFromYaml() throws Exception {
        writeFile("renamer.yaml",
            "name: batch-renamer",
            "agent_type: BATCH_RENAME",
            "description: Rename files by pattern",
            "priority: HIGH",
            "can_pause: false",
            "metadata:",
            "  pattern: \"{date}-{name}\"");

        definitionService.loadDefinitions();
        Optional<AgentDefinition> definition = definitionService.getDefinition("batch-renamer");

        assertTrue(definition.isPresent());
        assertEquals(AgentType.BATCH_RENAME, definition.get().getAgentType());
        assertEquals(AgentTaskPriority.HIGH, definition.get().getPriority());
        assertFalse(definition.get().isCanPause());
        assertTrue(definition.get().isCanCancel());
        assertEquals("{date}-{name}", definition.get().getMetadata().get("pattern"));
    }

    @Test
    void shouldReadYmlExtensionAndIgnoreOtherFiles() throws Exception {
        writeFile("cleanup.yml", "name: cleanup", "agent_type: CLEANUP");
        writeFile("notes.txt", "name: not-an-agent");

        definitionService.loadDefinitions();

        assertEquals(1, definitionService.getAllDefinitions().size());
        assertTrue(definitionService.getDefinition("cleanup").isPresent());
    }

    @Test
    void shouldSkipUnreadableAndNamelessDefinitions() throws Exception {
        writeFile("broken.yaml", "name: broken", "agent_type: NOT_A_TYPE");
        writeFile("nameless.yaml", "agent_type: SEARCH");
        writeFile("search.yaml", "name: search", "agent_type: SEARCH");

        definitionService.loadDefinitions();

        assertEquals(1, definitionService.getAllDefinitions().size());
        assertTrue(definitionService.getDefinition("search").isPresent());
    }

    @Test
    void shouldReturnEmptyWhenDirectoryMissing() {
        definitionService.setConfigPath(tempDir.resolve("missing").toString());

        definitionService.loadDefinitions();

        assertTrue(definitionService.getAllDefinitions().isEmpty());
        assertFalse(definitionService.getDefinition("anything").isPresent());
    }

    @Test
    void shouldCreatePendingTaskFromDefinition() throws Exception {
        writeFile("backup.yaml",
            "name: backup",
            "agent_type: BACKUP",
            "description: Copy home directory",
            "priority: CRITICAL",
            "can_cancel: false",
            "metadata:",
            "  target: /mnt/backup");
        definitionService.loadDefinitions();

        AgentTask task = definitionService.createTask("backup", null, 120, 4096L);

        assertEquals("backup", task.getAgentName());
        assertEquals(AgentType.BACKUP, task.getAgentType());
        assertEquals("Copy home directory", task.getDescription());
        assertEquals(AgentTaskPriority.CRITICAL, task.getPriority());
        assertEquals(AgentTaskStatus.PENDING, task.getStatus());
        assertFalse(task.isCanCancel());
        assertTrue(task.isCanPause());
        assertEquals(120, task.getTotalItems());
        assertEquals(4096L, task.getTotalBytes());
        assertEquals("/mnt/backup", task.getMetadata().get("target"));
    }

    @Test
    void shouldNotShareMetadataBetweenTasks() throws Exception {
        writeFile("dupes.yaml", "name: dupes", "agent_type: DUPLICATE", "metadata:", "  hash_algorithm: sha256");
        definitionService.loadDefinitions();

        AgentTask first = definitionService.createTask("dupes", "Scan photos", 10, 0);
        first.getMetadata().put("hash_algorithm", "md5");
        AgentTask second = definitionService.createTask("dupes", "Scan music", 10, 0);

        assertEquals("Scan photos", first.getDescription());
        assertEquals("sha256", second.getMetadata().get("hash_algorithm"));
        assertEquals("sha256", definitionService.getDefinition("dupes").orElseThrow().getMetadata().get("hash_algorithm"));
    }

    @Test
    void shouldRejectUnknownDefinition() {
        definitionService.loadDefinitions();

        InvalidTaskArgumentException error = assertThrows(InvalidTaskArgumentException.class,
            () -> definitionService.createTask("ghost", "Nothing", 1, 0));
        assertTrue(error.getMessage().contains("ghost"));
    }
}
