package com.newsdigest.backend.exception;

/**
 * Root of every failure raised by the digest engine.
 */
public class NewsDigestException extends RuntimeException {

    public NewsDigestException(String message) {
        super(message);
    }

    public NewsDigestException(String message, Throwable cause) {
        super(message, cause);
    }
}
