package com.newsdigest.backend.pipeline.service;

import com.newsdigest.backend.exception.StepInterruptedException;

/**
 * Cooperative control handed to item-level loops: the stop signal is polled between items and
 * each committed item is reported so a resumed step can skip it.
 */
public interface BatchControl {

    BatchControl NONE = new BatchControl() {
        @Override
        public String runId() {
            return null;
        }

        @Override
        public boolean stopRequested() {
            return false;
        }

        @Override
        public boolean isCommitted(Long itemId) {
            return false;
        }

        @Override
        public void committed(Long itemId, boolean success) {
        }
    };

    String runId();

    boolean stopRequested();

    boolean isCommitted(Long itemId);

    void committed(Long itemId, boolean success);

    default void checkStop() {
        if (stopRequested()) {
            throw new StepInterruptedException(runId(), "Stop requested");
        }
    }
}
