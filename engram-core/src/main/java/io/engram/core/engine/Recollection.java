package io.engram.core.engine;

import io.engram.core.retrieval.ClusterHit;
import io.engram.core.retrieval.LoopIteration;
import io.engram.core.retrieval.RetrievedUnit;
import java.time.Instant;
import java.util.List;

/**
 * What retrieval produced for a question. An empty recollection is a valid "nothing relevant
 * remembered" answer, not a failure.
 */
public record Recollection(
    String question,
    Instant referenceTime,
    List<RetrievedUnit> units,
    String context,
    List<String> queriesUsed,
    List<LoopIteration> iterations,
    boolean sufficient,
    List<ClusterHit> clusters
) {

    public Recollection {
        units = List.copyOf(units);
        queriesUsed = List.copyOf(queriesUsed);
        iterations = List.copyOf(iterations);
        clusters = List.copyOf(clusters);
        context = context == null ? "" : context;
    }

    public int searchCycles() {
        return iterations.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }
}
