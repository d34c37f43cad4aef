package io.engram.core.index;

public record ScoredId(String id, double score) {
}
