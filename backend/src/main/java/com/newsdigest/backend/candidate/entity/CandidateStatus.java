package com.newsdigest.backend.candidate.entity;

public enum CandidateStatus {
    COLLECTED,
    SELECTED,
    NEAR_MISS,
    NOT_SELECTED,
    BATCH_DUPLICATE,
    CROSS_RUN_DUPLICATE,
    UNIQUE;

    /**
     * Duplicates never re-enter active work.
     */
    public boolean isExcluded() {
        return this == BATCH_DUPLICATE || this == CROSS_RUN_DUPLICATE;
    }
}
