package com.knowledge.curation.core;

/**
 * Base class for all failures raised by the curation engine.
 * Unchecked so that callers can decide where a round or session boundary handles them.
 */
public class CurationException extends RuntimeException {

    public CurationException(String message) {
        super(message);
    }

    public CurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
