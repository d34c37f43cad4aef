package io.engram.core.engine;

public record MemorySpaceStats(String userId, int units, int clusters, int attributes, int traits, int conflicts) {
}
