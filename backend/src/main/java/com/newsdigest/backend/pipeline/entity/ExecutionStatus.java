package com.newsdigest.backend.pipeline.entity;

/**
 * Shared lifecycle of runs and steps: pending, running, then completed, failed or paused;
 * a paused run or step may run again. Failed is terminal.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    PAUSED;

    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == PAUSED;
            case PAUSED -> target == RUNNING;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
