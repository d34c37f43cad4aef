package io.engram.core.cluster;

import io.engram.core.memory.MemoryUnit;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Online clustering: a unit joins the most similar cluster when that similarity exceeds the
 * threshold, otherwise it seeds a new cluster. Clusters are never merged, split or deleted.
 */
public final class ThematicClusteringEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ThematicClusteringEngine.class);
    public static final double DEFAULT_THRESHOLD = 0.70;

    private final double threshold;
    private final ClusterLabeler labeler;
    private final Clock clock;

    public ThematicClusteringEngine() {
        this(DEFAULT_THRESHOLD, new KeywordClusterLabeler(), Clock.systemUTC());
    }

    public ThematicClusteringEngine(double threshold, ClusterLabeler labeler, Clock clock) {
        this.threshold = threshold;
        this.labeler = Objects.requireNonNull(labeler, "labeler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Assigns {@code unit} against {@code clusters}, which must be ordered by creation time.
     * A newly created cluster is appended to the list.
     */
    public ClusterAssignment assign(MemoryUnit unit, List<ThematicCluster> clusters) {
        Objects.requireNonNull(unit, "unit must not be null");
        if (unit.embedding().isEmpty()) {
            throw new IllegalArgumentException("memory unit " + unit.id() + " has no embedding");
        }

        ThematicCluster best = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (ThematicCluster cluster : clusters) {
            double similarity = cluster.similarityTo(unit.embedding());
            // strict comparison keeps the earliest cluster on ties
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                best = cluster;
            }
        }

        if (best != null && bestSimilarity > threshold) {
            best.absorb(unit.id(), unit.embedding(), labeler.mergeSummary(best.summary(), unit), clock.instant());
            LOG.debug("Unit {} joined cluster {} (similarity {})", unit.id(), best.id(), bestSimilarity);
            return new ClusterAssignment(best, false, bestSimilarity);
        }

        ThematicCluster created = ThematicCluster.seed(
            UUID.randomUUID().toString(),
            labeler.themeFor(unit),
            unit.narrative(),
            unit.id(),
            unit.embedding(),
            clock.instant()
        );
        clusters.add(created);
        LOG.debug("Unit {} seeded cluster {} '{}'", unit.id(), created.id(), created.themeLabel());
        return new ClusterAssignment(created, true, 1.0);
    }

    public double threshold() {
        return threshold;
    }
}
