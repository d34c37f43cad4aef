package io.engram.core.retrieval;

public enum LoopState {
    SEARCHING,
    EVALUATING,
    REFORMULATING,
    DONE
}
