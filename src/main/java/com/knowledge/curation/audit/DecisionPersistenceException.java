package com.knowledge.curation.audit;

import com.knowledge.curation.core.CurationException;

/**
 * Thrown when a decision record cannot be written.
 * The associated mutation must not be applied.
 */
public class DecisionPersistenceException extends CurationException {

    public DecisionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
