package io.engram.core.error;

/**
 * Drafting memory units from a conversation failed; the conversation produces no memory units.
 */
public class ExtractionException extends MemoryException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
