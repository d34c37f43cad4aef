package io.engram.core.engine;

import io.engram.core.config.model.MemoryConfig;
import java.time.Duration;

public record EngineSettings(
    double clusterThreshold,
    int rrfK,
    int topK,
    int maxContextUnits,
    int maxRetries,
    Duration queryTimeout,
    int searchThreads
) {

    public EngineSettings {
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            queryTimeout = Duration.ofSeconds(60);
        }
        topK = Math.max(1, topK);
        maxContextUnits = Math.max(1, maxContextUnits);
        maxRetries = Math.max(0, maxRetries);
        searchThreads = Math.max(2, searchThreads);
    }

    public static EngineSettings defaults() {
        return from(MemoryConfig.defaults());
    }

    public static EngineSettings from(MemoryConfig config) {
        return new EngineSettings(
            config.clusterThreshold(),
            config.rrfK(),
            config.topK(),
            config.maxContextUnits(),
            config.maxRetries(),
            Duration.ofSeconds(config.queryTimeoutSeconds()),
            config.searchThreads()
        );
    }
}
