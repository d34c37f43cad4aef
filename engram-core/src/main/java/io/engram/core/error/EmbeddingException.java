package io.engram.core.error;

public class EmbeddingException extends MemoryException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
