package com.knowledge.curation.config;

import com.knowledge.curation.core.CurationException;

/**
 * Thrown when configuration is malformed or inconsistent, e.g. non-monotonic thresholds.
 * Always fatal at startup; values are never clamped into range.
 */
public class CurationConfigurationException extends CurationException {

    public CurationConfigurationException(String message) {
        super(message);
    }

    public CurationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
