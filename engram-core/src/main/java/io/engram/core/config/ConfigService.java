package io.engram.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.engram.core.config.model.EmbeddingConfig;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.config.model.GenerationConfig;
import io.engram.core.config.model.MemoryConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads the config file deep-merged over {@link EngramConfig#defaults()}, so a partial file only
     * overrides the keys it names. A missing file yields the defaults.
     *
     * @throws IllegalArgumentException when the merged settings fail {@link #validate(EngramConfig)}
     */
    public EngramConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return EngramConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(EngramConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        EngramConfig config = mapper.treeToValue(merged, EngramConfig.class);
        validate(config);
        return config;
    }

    /**
     * Checks the numeric memory, embedding and generation settings. Provider and extraction names
     * are checked when the engine is built.
     */
    public void validate(EngramConfig config) {
        List<String> problems = new ArrayList<>();
        MemoryConfig memory = config.memory();
        if (memory == null) {
            problems.add("memory section is missing");
        } else {
            if (!(memory.clusterThreshold() > 0.0 && memory.clusterThreshold() <= 1.0)) {
                problems.add("memory.clusterThreshold must be in (0, 1], got " + memory.clusterThreshold());
            }
            atLeast(problems, "memory.rrfK", memory.rrfK(), 0);
            atLeast(problems, "memory.topK", memory.topK(), 1);
            atLeast(problems, "memory.maxContextUnits", memory.maxContextUnits(), 1);
            atLeast(problems, "memory.maxRetries", memory.maxRetries(), 0);
            atLeast(problems, "memory.queryTimeoutSeconds", memory.queryTimeoutSeconds(), 1);
            atLeast(problems, "memory.searchThreads", memory.searchThreads(), 1);
        }
        EmbeddingConfig embedding = config.embedding();
        if (embedding == null) {
            problems.add("embedding section is missing");
        } else {
            atLeast(problems, "embedding.dimension", embedding.dimension(), 0);
            atLeast(problems, "embedding.maxAttempts", embedding.maxAttempts(), 1);
        }
        GenerationConfig generation = config.generation();
        if (generation == null) {
            problems.add("generation section is missing");
        } else {
            atLeast(problems, "generation.maxAttempts", generation.maxAttempts(), 1);
        }
        if (config.providers() == null) {
            problems.add("providers section is missing");
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid config: " + String.join("; ", problems));
        }
    }

    public void save(Path configPath, EngramConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        EngramConfig config;
        if (created || overwrite) {
            config = EngramConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.workspace());
        Path spaces = Files.createDirectories(ConfigPaths.spacesDirectory(workspace));
        return new OnboardResult(configPath, workspace, spaces, config, created, overwritten);
    }

    public String toPrettyJson(EngramConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private static void atLeast(List<String> problems, String key, int value, int minimum) {
        if (value < minimum) {
            problems.add(key + " must be at least " + minimum + ", got " + value);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
