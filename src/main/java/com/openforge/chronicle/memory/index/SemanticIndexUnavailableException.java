package com.openforge.chronicle.memory.index;

/**
 * Raised by a {@link SemanticIndex} that is, or just became, unavailable.
 * Callers degrade instead of retrying.
 */
public class SemanticIndexUnavailableException extends RuntimeException {

    public SemanticIndexUnavailableException(String message) {
        super(message);
    }

    public SemanticIndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
