package com.newsdigest.backend.exception;

/**
 * Thresholds, counts or modes are invalid. Raised before a run writes any state.
 */
public class InvalidConfigurationException extends NewsDigestException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
