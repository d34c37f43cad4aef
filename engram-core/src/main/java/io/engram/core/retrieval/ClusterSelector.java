package io.engram.core.retrieval;

import io.engram.core.cluster.ThematicCluster;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks the clusters behind a set of retrieved units by their best member score.
 */
public final class ClusterSelector {

    public List<ClusterHit> select(List<RetrievedUnit> units, Map<String, ThematicCluster> clusters, int limit) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (RetrievedUnit retrieved : units) {
            String clusterId = retrieved.unit().clusterId();
            if (clusterId != null && clusters.containsKey(clusterId)) {
                best.merge(clusterId, retrieved.score(), Math::max);
            }
        }
        List<ClusterHit> hits = new ArrayList<>();
        best.forEach((id, score) -> hits.add(new ClusterHit(id, clusters.get(id).themeLabel(), score)));
        hits.sort(Comparator.comparingDouble(ClusterHit::score).reversed());
        return hits.subList(0, Math.min(Math.max(0, limit), hits.size()));
    }
}
