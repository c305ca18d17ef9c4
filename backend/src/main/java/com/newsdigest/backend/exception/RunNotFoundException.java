package com.newsdigest.backend.exception;

public class RunNotFoundException extends NewsDigestException {

    public RunNotFoundException(String runId) {
        super("Pipeline run not found: " + runId);
    }
}
