package io.engram.core.error;

/**
 * A dense or sparse search could not be served. Retrieval never degrades to the other modality.
 */
public class IndexUnavailableException extends MemoryException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
