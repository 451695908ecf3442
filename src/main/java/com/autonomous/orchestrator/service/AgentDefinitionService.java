package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.InvalidTaskArgumentException;
import com.autonomous.orchestrator.model.AgentDefinition;
import com.autonomous.orchestrator.model.AgentTask;
import com.autonomous.orchestrator.model.AgentTaskPriority;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of agent defaults read from YAML, and the factory producers use to build
 * pending tasks from them.
 */
@Slf4j
@Service
public class AgentDefinitionService {

    @Value("${agent.config.path:config/agents}")
    private String configPath;

    private final Map<String, AgentDefinition> definitions = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public AgentDefinitionService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadDefinitions() {
        definitions.clear();
        File configDir = new File(configPath);

        if (!configDir.exists() || !configDir.isDirectory()) {
            log.info("Agent definition directory not found: {}", configPath);
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return;

        for (File file : yamlFiles) {
            try {
                AgentDefinition definition = yamlMapper.readValue(file, AgentDefinition.class);
                if (definition.getName() != null && !definition.getName().isBlank()) {
                    definitions.put(definition.getName(), definition);
                    log.info("Loaded agent definition: {} ({})", definition.getName(), definition.getAgentType());
                }
            } catch (Exception e) {
                log.warn("Failed to load agent definition from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public Optional<AgentDefinition> getDefinition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Map<String, AgentDefinition> getAllDefinitions() {
        return Map.copyOf(definitions);
    }

    /**
     * Builds a pending task carrying the definition's type, priority and capability flags.
     */
    public AgentTask createTask(String definitionName, String description, int totalItems, long totalBytes) {
        AgentDefinition definition = getDefinition(definitionName)
            .orElseThrow(() -> new InvalidTaskArgumentException(null, "Unknown agent definition: " + definitionName));

        return AgentTask.builder()
            .agentName(definition.getName())
            .agentType(definition.getAgentType())
            .description(description != null ? description : nullToEmpty(definition.getDescription()))
            .priority(definition.getPriority() != null ? definition.getPriority() : AgentTaskPriority.NORMAL)
            .canPause(definition.isCanPause())
            .canCancel(definition.isCanCancel())
            .totalItems(totalItems)
            .totalBytes(totalBytes)
            .metadata(definition.getMetadata() != null ? new LinkedHashMap<>(definition.getMetadata()) : new LinkedHashMap<>())
            .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
