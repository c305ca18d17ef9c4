package com.newsdigest.backend.exception;

/**
 * The comparison service itself cannot be reached. The dedup step degrades to a pass-through.
 */
public class ComparisonServiceUnavailableException extends NewsDigestException {

    public ComparisonServiceUnavailableException(String message) {
        super(message);
    }

    public ComparisonServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
