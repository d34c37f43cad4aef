package io.engram.core.retrieval;

import io.engram.core.index.LexicalIndex;
import io.engram.core.index.VectorIndex;
import io.engram.core.memory.MemoryUnit;
import io.engram.core.profile.UserProfile;
import io.engram.core.temporal.TemporalFilter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One search cycle over a user's memory: hybrid search, superseded-fact suppression, temporal
 * filtering, then truncation to the context budget. Fused order is preserved throughout.
 */
public final class RetrievalPipeline {
    private final HybridSearch search;
    private final SupersededFactFilter supersededFilter;
    private final TemporalFilter temporalFilter;
    private final int maxContextUnits;

    public RetrievalPipeline(HybridSearch search, int maxContextUnits) {
        this(search, new SupersededFactFilter(), new TemporalFilter(), maxContextUnits);
    }

    public RetrievalPipeline(
        HybridSearch search,
        SupersededFactFilter supersededFilter,
        TemporalFilter temporalFilter,
        int maxContextUnits
    ) {
        this.search = Objects.requireNonNull(search, "search must not be null");
        this.supersededFilter = Objects.requireNonNull(supersededFilter, "supersededFilter must not be null");
        this.temporalFilter = Objects.requireNonNull(temporalFilter, "temporalFilter must not be null");
        this.maxContextUnits = Math.max(1, maxContextUnits);
    }

    /**
     * Binds the pipeline to one consistent view of a user's memory.
     */
    public Retriever over(
        Map<String, MemoryUnit> units,
        UserProfile profile,
        VectorIndex vectorIndex,
        LexicalIndex lexicalIndex,
        Instant reference
    ) {
        return query -> {
            Map<String, Double> scores = new HashMap<>();
            List<MemoryUnit> candidates = new ArrayList<>();
            for (FusedCandidate candidate : search.search(query, vectorIndex, lexicalIndex)) {
                MemoryUnit unit = units.get(candidate.id());
                // indexes may briefly lag or lead the unit map
                if (unit != null) {
                    candidates.add(unit);
                    scores.put(unit.id(), candidate.score());
                }
            }
            List<MemoryUnit> current = temporalFilter.apply(supersededFilter.apply(candidates, profile), reference);
            return current.stream()
                .limit(maxContextUnits)
                .map(unit -> new RetrievedUnit(unit, scores.getOrDefault(unit.id(), 0.0)))
                .toList();
        };
    }
}
