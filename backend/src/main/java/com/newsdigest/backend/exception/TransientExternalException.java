package com.newsdigest.backend.exception;

/**
 * A single call to the comparison service timed out or returned a server error.
 * Retried with backoff, then handled fail-open for the affected item.
 */
public class TransientExternalException extends NewsDigestException {

    public TransientExternalException(String message) {
        super(message);
    }

    public TransientExternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
