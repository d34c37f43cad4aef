package io.engram.cli;

import io.engram.core.config.ConfigService;
import io.engram.core.engine.MemoryEngine;
import java.nio.file.Path;

public record CliContext(
    MemoryEngine engine,
    ConfigService configService,
    Path configPath
) {
}
