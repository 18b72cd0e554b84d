package com.knowledge.curation.review;

import com.knowledge.curation.core.CurationException;

/**
 * Thrown for reviewer input that is not one of the supported commands.
 */
public class InvalidCommandException extends CurationException {

    public InvalidCommandException(String message) {
        super(message);
    }
}
