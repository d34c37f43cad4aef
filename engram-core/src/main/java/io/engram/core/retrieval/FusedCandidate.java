package io.engram.core.retrieval;

/**
 * One fused result. A rank is {@code 0} when the id was absent from that list.
 */
public record FusedCandidate(String id, double score, int denseRank, int sparseRank) {

    public boolean inBothLists() {
        return denseRank > 0 && sparseRank > 0;
    }
}
