package io.engram.core.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion of a dense and a sparse ranking:
 * {@code score(id) = 1/(k + rankDense) + 1/(k + rankSparse)}, an absent id contributing nothing
 * for that list. Equal scores are ordered by the lower rank sum (an absent rank counts as one past
 * the longer list), then by id.
 */
public final class RankFusion {
    public static final int DEFAULT_K = 60;

    private final int k;

    public RankFusion() {
        this(DEFAULT_K);
    }

    public RankFusion(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative");
        }
        this.k = k;
    }

    public List<FusedCandidate> fuse(List<String> denseRanking, List<String> sparseRanking) {
        Map<String, Integer> dense = ranks(denseRanking);
        Map<String, Integer> sparse = ranks(sparseRanking);

        Map<String, FusedCandidate> fused = new LinkedHashMap<>();
        for (String id : dense.keySet()) {
            fused.put(id, candidate(id, dense, sparse));
        }
        for (String id : sparse.keySet()) {
            fused.computeIfAbsent(id, key -> candidate(key, dense, sparse));
        }

        int absentRank = Math.max(dense.size(), sparse.size()) + 1;
        Comparator<FusedCandidate> order = Comparator
            .comparingDouble(FusedCandidate::score).reversed()
            .thenComparingInt(candidate -> rankSum(candidate, absentRank))
            .thenComparing(FusedCandidate::id);

        List<FusedCandidate> result = new ArrayList<>(fused.values());
        result.sort(order);
        return result;
    }

    public int k() {
        return k;
    }

    private FusedCandidate candidate(String id, Map<String, Integer> dense, Map<String, Integer> sparse) {
        int denseRank = dense.getOrDefault(id, 0);
        int sparseRank = sparse.getOrDefault(id, 0);
        return new FusedCandidate(id, contribution(denseRank) + contribution(sparseRank), denseRank, sparseRank);
    }

    private double contribution(int rank) {
        return rank == 0 ? 0.0 : 1.0 / (k + rank);
    }

    private int rankSum(FusedCandidate candidate, int absentRank) {
        int dense = candidate.denseRank() == 0 ? absentRank : candidate.denseRank();
        int sparse = candidate.sparseRank() == 0 ? absentRank : candidate.sparseRank();
        return dense + sparse;
    }

    // a repeated id keeps its best (first) position
    private Map<String, Integer> ranks(List<String> ranking) {
        Map<String, Integer> ranks = new LinkedHashMap<>();
        if (ranking == null) {
            return ranks;
        }
        int position = 1;
        for (String id : ranking) {
            if (id != null) {
                ranks.putIfAbsent(id, position);
            }
            position++;
        }
        return ranks;
    }
}
