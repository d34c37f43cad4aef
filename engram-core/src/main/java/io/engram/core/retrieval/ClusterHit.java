package io.engram.core.retrieval;

public record ClusterHit(String clusterId, String themeLabel, double score) {
}
