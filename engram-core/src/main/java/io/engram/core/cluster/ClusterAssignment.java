package io.engram.core.cluster;

public record ClusterAssignment(ThematicCluster cluster, boolean created, double similarity) {
}
