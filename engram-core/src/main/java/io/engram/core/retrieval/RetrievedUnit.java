package io.engram.core.retrieval;

import io.engram.core.memory.MemoryUnit;

/**
 * A unit as it enters the context: superseded facts removed and only currently valid foresights kept.
 */
public record RetrievedUnit(MemoryUnit unit, double score) {
}
