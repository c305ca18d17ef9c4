package com.newsdigest.backend.exception;

/**
 * The comparison service answered, but not with a judgment we can trust.
 */
public class ComparisonResponseParseException extends NewsDigestException {

    public ComparisonResponseParseException(String message) {
        super(message);
    }

    public ComparisonResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
