package io.engram.core.retrieval;

import java.util.List;

/**
 * Result of the sufficiency loop. {@code units} and {@code context} come from the last search cycle.
 */
public record LoopOutcome(
    List<RetrievedUnit> units,
    String context,
    List<String> queriesUsed,
    List<LoopIteration> iterations,
    boolean sufficient
) {

    public LoopOutcome {
        units = List.copyOf(units);
        queriesUsed = List.copyOf(queriesUsed);
        iterations = List.copyOf(iterations);
    }

    public int searchCycles() {
        return iterations.size();
    }
}
