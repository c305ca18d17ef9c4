package com.newsdigest.backend.exception;

public class IllegalRunTransitionException extends NewsDigestException {

    public IllegalRunTransitionException(String message) {
        super(message);
    }
}
