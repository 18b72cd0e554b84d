package com.knowledge.curation.provider;

import com.knowledge.curation.core.CurationException;

/**
 * Thrown when the vector, rerank or LLM provider cannot be reached.
 * Graph building fails the round; adjudication defers the candidate to manual review.
 */
public class ProviderUnavailableException extends CurationException {

    private final String providerName;

    public ProviderUnavailableException(String providerName, String message) {
        super(providerName + ": " + message);
        this.providerName = providerName;
    }

    public ProviderUnavailableException(String providerName, String message, Throwable cause) {
        super(providerName + ": " + message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
