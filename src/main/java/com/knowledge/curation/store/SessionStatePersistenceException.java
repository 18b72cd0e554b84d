package com.knowledge.curation.store;

import com.knowledge.curation.core.CurationException;

/**
 * Thrown when a session checkpoint cannot be written or read.
 */
public class SessionStatePersistenceException extends CurationException {

    public SessionStatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
