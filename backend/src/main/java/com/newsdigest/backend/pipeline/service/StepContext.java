package com.newsdigest.backend.pipeline.service;

import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.pipeline.dto.RunState;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import java.time.LocalDate;
import java.util.Set;

/**
 * One step execution of one run. Committed items are checkpointed through the state machine as
 * they happen, so a stop or crash loses at most the item in flight.
 */
public class StepContext implements BatchControl {

    private final RunState runState;
    private final PipelineStep step;
    private final RunStateMachine stateMachine;
    private final Set<Long> committedItems;

    public StepContext(RunState runState, PipelineStep step, RunStateMachine stateMachine, Set<Long> committedItems) {
        this.runState = runState;
        this.step = step;
        this.stateMachine = stateMachine;
        this.committedItems = committedItems;
    }

    public RunState getRunState() {
        return runState;
    }

    public PipelineStep getStep() {
        return step;
    }

    public LocalDate getDay() {
        return runState.getDay();
    }

    public DedupProperties.ModeSettings getSettings() {
        return runState.getSettings();
    }

    @Override
    public String runId() {
        return runState.getRunId();
    }

    @Override
    public boolean stopRequested() {
        return runState.isStopRequested();
    }

    @Override
    public boolean isCommitted(Long itemId) {
        return committedItems.contains(itemId);
    }

    @Override
    public void committed(Long itemId, boolean success) {
        stateMachine.recordCheckpoint(runState.getRunId(), step, itemId, success);
        committedItems.add(itemId);
    }

    public int committedCount() {
        return committedItems.size();
    }

    /**
     * Overwrite the step's counts, for steps that commit their work as a whole rather than per item.
     */
    public void recordProgress(int processed, int succeeded, int failed) {
        stateMachine.recordProgress(runState.getRunId(), step, processed, succeeded, failed);
    }
}
