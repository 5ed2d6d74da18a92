package com.coa.exception;

/**
 * Exception thrown when a rule, relevance or scoring file is invalid.
 * Callers that own a fallback policy convert it into a CONFIGURATION diagnostic.
 */
public class ConfigurationException extends CoaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
