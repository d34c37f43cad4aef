package io.engram.app;

import io.engram.cli.CliContext;
import io.engram.cli.EngramCliCommand;
import io.engram.core.config.ConfigPaths;
import io.engram.core.config.ConfigService;
import io.engram.core.config.model.EngramConfig;
import io.engram.core.engine.MemoryEngine;
import io.engram.core.engine.MemoryEngineFactory;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EngramApplication {
    private static final Logger LOG = LoggerFactory.getLogger(EngramApplication.class);

    private EngramApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = configPath();
        EngramConfig config = loadConfig(configService, configPath);

        int exitCode;
        try (MemoryEngine engine = buildEngine(config)) {
            CliContext context = new CliContext(engine, configService, configPath);
            exitCode = EngramCliCommand.create(context).execute(args);
        }
        System.exit(exitCode);
    }

    private static Path configPath() {
        String override = System.getenv("ENGRAM_CONFIG");
        if (override == null || override.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolveWorkspace(override);
    }

    private static EngramConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not load {}, using defaults: {}", configPath, e.getMessage());
            return EngramConfig.defaults();
        }
    }

    private static MemoryEngine buildEngine(EngramConfig config) {
        try {
            return MemoryEngineFactory.create(config);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration (" + e.getMessage() + "), falling back to offline defaults");
            EngramConfig defaults = EngramConfig.defaults();
            return MemoryEngineFactory.create(new EngramConfig(
                config.workspace(),
                config.memory(),
                defaults.embedding(),
                defaults.generation(),
                config.providers()
            ));
        }
    }
}
