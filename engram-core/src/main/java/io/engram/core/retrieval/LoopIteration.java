package io.engram.core.retrieval;

import java.util.List;

/**
 * Trace of one search cycle: the query text searched, the unit ids it produced and the verdict.
 */
public record LoopIteration(int cycle, String query, List<String> unitIds, boolean sufficient, String rationale) {

    public LoopIteration {
        unitIds = unitIds == null ? List.of() : List.copyOf(unitIds);
        rationale = rationale == null ? "" : rationale;
    }
}
