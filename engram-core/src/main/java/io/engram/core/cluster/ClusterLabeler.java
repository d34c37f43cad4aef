package io.engram.core.cluster;

import io.engram.core.memory.MemoryUnit;

public interface ClusterLabeler {
    String themeFor(MemoryUnit seed);

    String mergeSummary(String currentSummary, MemoryUnit newcomer);
}
