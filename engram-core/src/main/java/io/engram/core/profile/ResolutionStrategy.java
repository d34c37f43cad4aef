package io.engram.core.profile;

public enum ResolutionStrategy {
    RECENCY
}
