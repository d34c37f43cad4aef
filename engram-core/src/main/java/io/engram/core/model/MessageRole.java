package io.engram.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
