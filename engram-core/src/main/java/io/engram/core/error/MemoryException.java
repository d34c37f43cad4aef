package io.engram.core.error;

/**
 * Base type for failures raised by the memory engine and its collaborators.
 */
public class MemoryException extends RuntimeException {

    public MemoryException(String message) {
        super(message);
    }

    public MemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
