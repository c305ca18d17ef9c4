package com.newsdigest.backend.exception;

/**
 * Persistent state could not be read or written. Fatal for the run.
 */
public class StateStoreException extends NewsDigestException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
