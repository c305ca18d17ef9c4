package com.newsdigest.backend.exception;

import lombok.Getter;

/**
 * A candidate record is malformed. The item is skipped, the batch continues.
 */
@Getter
public class DataIntegrityException extends NewsDigestException {

    private final String field;

    public DataIntegrityException(String field, String message) {
        super(message);
        this.field = field;
    }
}
