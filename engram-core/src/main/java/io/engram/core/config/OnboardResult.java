package io.engram.core.config;

import io.engram.core.config.model.EngramConfig;
import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path workspacePath,
    Path spacesPath,
    EngramConfig config,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
