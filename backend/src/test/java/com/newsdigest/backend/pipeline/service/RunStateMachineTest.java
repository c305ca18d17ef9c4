package com.newsdigest.backend.pipeline.service;

import static com.newsdigest.backend.support.Candidates.DAY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.exception.IllegalRunTransitionException;
import com.newsdigest.backend.exception.InvalidConfigurationException;
import com.newsdigest.backend.exception.RunNotFoundException;
import com.newsdigest.backend.pipeline.dto.RunState;
import com.newsdigest.backend.pipeline.dto.RunStatusDTO;
import com.newsdigest.backend.pipeline.dto.StepStatusDTO;
import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.entity.StepRecord;
import com.newsdigest.backend.pipeline.repository.PipelineRunRepository;
import com.newsdigest.backend.pipeline.repository.StepCheckpointRepository;
import com.newsdigest.backend.pipeline.repository.StepRecordRepository;
import com.newsdigest.backend.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class RunStateMachineTest {

    @Autowired
    private PipelineRunRepository runRepository;

    @Autowired
    private StepRecordRepository stepRepository;

    @Autowired
    private StepCheckpointRepository checkpointRepository;

    private final DedupProperties properties = new DedupProperties();
    private MutableClock clock;
    private RunStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(DAY.atTime(9, 0));
        stateMachine = new RunStateMachine(runRepository, stepRepository, checkpointRepository, properties, clock);
    }

    @Test
    void newRunHasEveryStepPending() {
        RunState state = stateMachine.createRun(PipelineMode.EXPRESS, DAY);

        RunStatusDTO status = stateMachine.getRunStatus(state.getRunId());

        assertEquals(ExecutionStatus.PENDING, status.getStatus());
        assertEquals(PipelineMode.EXPRESS, status.getMode());
        assertEquals(6, status.getTotalSteps());
        assertEquals(PipelineStep.ordered(), status.getSteps().stream().map(StepStatusDTO::getStep).toList());
        assertTrue(status.getSteps().stream().allMatch(s -> s.getStatus() == ExecutionStatus.PENDING));
        assertEquals(0.85, state.getSettings().getSimilarityThreshold());
        assertEquals(10, state.getSettings().getMaxCount());
    }

    @Test
    @DisplayName("Invalid settings are rejected before anything is stored")
    void invalidSettingsLeaveNoRun() {
        properties.getModes().get(PipelineMode.DEEP).setSimilarityThreshold(1.4);

        assertThrows(InvalidConfigurationException.class, () -> stateMachine.createRun(PipelineMode.DEEP, DAY));
        assertThrows(InvalidConfigurationException.class, () -> stateMachine.createRun(null, DAY));
        assertEquals(0, runRepository.count());
        assertEquals(0, stepRepository.count());
    }

    @Test
    void illegalTransitionsAreRejected() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();

        assertThrows(IllegalRunTransitionException.class, () -> stateMachine.completeStep(runId, PipelineStep.COLLECTION));
        assertThrows(IllegalRunTransitionException.class, () -> stateMachine.completeRun(runId));

        stateMachine.markRunning(runId);
        assertThrows(IllegalRunTransitionException.class, () -> stateMachine.resume(runId));
    }

    @Test
    void unknownRunIsReported() {
        assertThrows(RunNotFoundException.class, () -> stateMachine.getRunStatus("missing"));
        assertThrows(RunNotFoundException.class, () -> stateMachine.resume("missing"));
    }

    @Test
    @DisplayName("A failed run records its error and cannot be resumed")
    void failedRunIsTerminal() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(runId);
        stateMachine.enterStep(runId, PipelineStep.COLLECTION);

        stateMachine.failStep(runId, PipelineStep.COLLECTION, "feed unreachable");

        RunStatusDTO status = stateMachine.getRunStatus(runId);
        assertEquals(ExecutionStatus.FAILED, status.getStatus());
        assertEquals("COLLECTION: feed unreachable", status.getErrorMessage());
        assertEquals(ExecutionStatus.FAILED, status.getSteps().get(0).getStatus());
        assertEquals("feed unreachable", status.getSteps().get(0).getErrorMessage());
        assertThrows(IllegalRunTransitionException.class, () -> stateMachine.resume(runId));
    }

    @Test
    @DisplayName("Resume re-enters the earliest unfinished step and never a completed one")
    void resumePicksEarliestUnfinishedStep() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(runId);
        stateMachine.enterStep(runId, PipelineStep.COLLECTION);
        stateMachine.completeStep(runId, PipelineStep.COLLECTION);
        stateMachine.enterStep(runId, PipelineStep.FILTERING);
        stateMachine.pause(runId, PipelineStep.FILTERING, "Stop requested");

        assertEquals(ExecutionStatus.PAUSED, stateMachine.getRun(runId).getStatus());
        assertEquals(ExecutionStatus.PAUSED, step(runId, PipelineStep.FILTERING).getStatus());

        Optional<PipelineStep> next = stateMachine.resume(runId);

        assertEquals(Optional.of(PipelineStep.FILTERING), next);
        assertEquals(ExecutionStatus.RUNNING, stateMachine.getRun(runId).getStatus());
        assertEquals(ExecutionStatus.RUNNING, step(runId, PipelineStep.FILTERING).getStatus());
        assertEquals(ExecutionStatus.COMPLETED, step(runId, PipelineStep.COLLECTION).getStatus());
    }

    @Test
    void resumeSkipsStepsThatCannotBeResumed() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(runId);
        StepRecord collection = step(runId, PipelineStep.COLLECTION);
        collection.setCanResume(false);
        stepRepository.save(collection);
        stateMachine.pause(runId, null, "Stop requested");

        assertEquals(Optional.of(PipelineStep.FILTERING), stateMachine.resume(runId));
    }

    @Test
    void resumingACompletedRunHasNothingToDo() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(runId);
        for (PipelineStep step : PipelineStep.ordered()) {
            stateMachine.enterStep(runId, step);
            stateMachine.completeStep(runId, step);
        }
        stateMachine.completeRun(runId);

        assertTrue(stateMachine.resume(runId).isEmpty());
        assertEquals(6, stateMachine.getRunStatus(runId).getCompletedSteps());
    }

    @Test
    void staleRunningRunIsPausedForRecovery() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(runId);
        stateMachine.enterStep(runId, PipelineStep.COLLECTION);

        assertTrue(stateMachine.pauseStale(runId));
        assertEquals(ExecutionStatus.PAUSED, step(runId, PipelineStep.COLLECTION).getStatus());
        assertFalse(stateMachine.pauseStale(runId));
        assertEquals(Optional.of(PipelineStep.COLLECTION), stateMachine.resume(runId));
    }

    @Test
    @DisplayName("Checkpointing the same item twice counts it once")
    void checkpointsAreIdempotent() {
        String runId = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(runId);
        stateMachine.enterStep(runId, PipelineStep.DEDUP);

        stateMachine.recordCheckpoint(runId, PipelineStep.DEDUP, 11L, true);
        stateMachine.recordCheckpoint(runId, PipelineStep.DEDUP, 12L, false);
        stateMachine.recordCheckpoint(runId, PipelineStep.DEDUP, 11L, true);

        StepRecord dedup = step(runId, PipelineStep.DEDUP);
        assertEquals(2, dedup.getProcessedCount());
        assertEquals(1, dedup.getSucceededCount());
        assertEquals(1, dedup.getFailedCount());
        assertEquals(Set.of(11L, 12L), stateMachine.committedItems(runId, PipelineStep.DEDUP));
        assertTrue(stateMachine.committedItems(runId, PipelineStep.FILTERING).isEmpty());
    }

    @Test
    void listIncompleteExcludesFinishedRuns() {
        String paused = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(paused);
        stateMachine.pause(paused, null, "Stop requested");
        String failed = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.failRun(failed, "boom");

        List<String> incomplete = stateMachine.listIncomplete().stream().map(RunStatusDTO::getRunId).toList();

        assertEquals(List.of(paused), incomplete);
    }

    @Test
    @DisplayName("Cleanup deletes old finished runs and keeps paused ones whatever their age")
    void cleanupKeepsUnfinishedRuns() {
        String oldCompleted = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(oldCompleted);
        stateMachine.completeRun(oldCompleted);
        String oldPaused = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(oldPaused);
        stateMachine.pause(oldPaused, null, "Stop requested");

        clock.advance(Duration.ofDays(40));
        String recentCompleted = stateMachine.createRun(PipelineMode.STANDARD, DAY).getRunId();
        stateMachine.markRunning(recentCompleted);
        stateMachine.completeRun(recentCompleted);

        int deleted = stateMachine.cleanup(30);

        assertEquals(1, deleted);
        assertFalse(runRepository.existsById(oldCompleted));
        assertTrue(stepRepository.findByRunIdOrderByStepOrderAsc(oldCompleted).isEmpty());
        assertTrue(runRepository.existsById(oldPaused));
        assertTrue(runRepository.existsById(recentCompleted));
    }

    private StepRecord step(String runId, PipelineStep step) {
        return stepRepository.findByRunIdAndStep(runId, step).orElseThrow();
    }
}
