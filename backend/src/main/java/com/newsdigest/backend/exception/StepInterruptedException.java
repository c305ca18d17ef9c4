package com.newsdigest.backend.exception;

import lombok.Getter;

/**
 * Thrown from inside a step when a stop signal is observed between two item operations.
 */
@Getter
public class StepInterruptedException extends NewsDigestException {

    private final String runId;

    public StepInterruptedException(String runId, String message) {
        super(message);
        this.runId = runId;
    }
}
