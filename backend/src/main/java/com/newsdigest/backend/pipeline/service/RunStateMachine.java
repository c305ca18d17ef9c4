package com.newsdigest.backend.pipeline.service;

import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.exception.IllegalRunTransitionException;
import com.newsdigest.backend.exception.InvalidConfigurationException;
import com.newsdigest.backend.exception.RunNotFoundException;
import com.newsdigest.backend.exception.StateStoreException;
import com.newsdigest.backend.pipeline.dto.RunState;
import com.newsdigest.backend.pipeline.dto.RunStatusDTO;
import com.newsdigest.backend.pipeline.dto.StepStatusDTO;
import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.entity.PipelineRun;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.entity.StepCheckpoint;
import com.newsdigest.backend.pipeline.entity.StepRecord;
import com.newsdigest.backend.pipeline.repository.PipelineRunRepository;
import com.newsdigest.backend.pipeline.repository.StepCheckpointRepository;
import com.newsdigest.backend.pipeline.repository.StepRecordRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent lifecycle of runs and their steps. Every transition is checked against
 * {@link ExecutionStatus#canTransitionTo}; storage failures surface as {@link StateStoreException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunStateMachine {

    private static final List<ExecutionStatus> INCOMPLETE = List.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING, ExecutionStatus.PAUSED);
    private static final List<ExecutionStatus> FINISHED = List.of(ExecutionStatus.COMPLETED, ExecutionStatus.FAILED);

    private final PipelineRunRepository runRepository;
    private final StepRecordRepository stepRepository;
    private final StepCheckpointRepository checkpointRepository;
    private final DedupProperties dedupProperties;
    private final Clock clock;

    /**
     * Create a pending run with one pending record per declared step. Settings are validated
     * first, so an invalid mode never leaves a run behind.
     */
    @Transactional
    public RunState createRun(PipelineMode mode, LocalDate day) {
        if (mode == null) {
            throw new InvalidConfigurationException("Pipeline mode is required");
        }
        if (day == null) {
            throw new InvalidConfigurationException("Digest day is required");
        }
        DedupProperties.ModeSettings settings = dedupProperties.settingsFor(mode);
        String runId = UUID.randomUUID().toString();

        inStore("create run " + runId, () -> {
            runRepository.save(PipelineRun.builder()
                    .runId(runId)
                    .mode(mode)
                    .digestDay(day)
                    .createdAt(now())
                    .build());
            for (PipelineStep step : PipelineStep.ordered()) {
                stepRepository.save(StepRecord.builder()
                        .runId(runId)
                        .step(step)
                        .stepOrder(step.getOrder())
                        .canResume(step.isResumable())
                        .build());
            }
            return null;
        });

        log.info("🆕 Created pipeline run {} ({} mode, day {}, similarity {}, confidence {}, max {})",
                runId, mode, day, settings.getSimilarityThreshold(), settings.getConfidenceThreshold(), settings.getMaxCount());
        return new RunState(runId, mode, day, settings);
    }

    /**
     * Rebuild the in-memory state of a persisted run, e.g. for resume.
     */
    @Transactional(readOnly = true)
    public RunState stateOf(String runId) {
        PipelineRun run = loadRun(runId);
        return new RunState(run.getRunId(), run.getMode(), run.getDigestDay(), dedupProperties.settingsFor(run.getMode()));
    }

    @Transactional
    public void markRunning(String runId) {
        inStore("start run " + runId, () -> {
            PipelineRun run = loadRun(runId);
            transition("run " + runId, run.getStatus(), ExecutionStatus.RUNNING);
            run.setStatus(ExecutionStatus.RUNNING);
            if (run.getStartedAt() == null) {
                run.setStartedAt(now());
            }
            return runRepository.save(run);
        });
    }

    @Transactional
    public void enterStep(String runId, PipelineStep step) {
        inStore("enter step " + step, () -> {
            StepRecord record = loadStep(runId, step);
            if (record.getStatus() != ExecutionStatus.RUNNING) {
                transition("step " + step, record.getStatus(), ExecutionStatus.RUNNING);
                record.setStatus(ExecutionStatus.RUNNING);
                if (record.getStartedAt() == null) {
                    record.setStartedAt(now());
                }
                stepRepository.save(record);
            }
            PipelineRun run = loadRun(runId);
            run.setCurrentStep(step);
            return runRepository.save(run);
        });
        log.info("▶️ Run {}: step {} running", runId, step);
    }

    @Transactional
    public void completeStep(String runId, PipelineStep step) {
        StepRecord record = inStore("complete step " + step, () -> {
            StepRecord current = loadStep(runId, step);
            transition("step " + step, current.getStatus(), ExecutionStatus.COMPLETED);
            current.setStatus(ExecutionStatus.COMPLETED);
            current.setCompletedAt(now());
            return stepRepository.save(current);
        });
        log.info("✅ Run {}: step {} completed ({} processed, {} succeeded, {} failed)",
                runId, step, record.getProcessedCount(), record.getSucceededCount(), record.getFailedCount());
    }

    /**
     * Fail the step with its error and the enclosing run with it. The run cannot be resumed afterwards.
     */
    @Transactional
    public void failStep(String runId, PipelineStep step, String errorMessage) {
        inStore("fail step " + step, () -> {
            StepRecord record = loadStep(runId, step);
            if (record.getStatus().canTransitionTo(ExecutionStatus.FAILED)) {
                record.setStatus(ExecutionStatus.FAILED);
                record.setCompletedAt(now());
            }
            record.setErrorMessage(errorMessage);
            stepRepository.save(record);
            return failRunInternal(runId, step + ": " + errorMessage);
        });
        log.error("❌ Run {} failed in step {}: {}", runId, step, errorMessage);
    }

    @Transactional
    public void failRun(String runId, String errorMessage) {
        inStore("fail run " + runId, () -> failRunInternal(runId, errorMessage));
        log.error("❌ Run {} failed: {}", runId, errorMessage);
    }

    /**
     * Pause the run; the step, if it was running, is paused with the reason. Items it already
     * committed stay committed as its checkpoint.
     */
    @Transactional
    public void pause(String runId, PipelineStep step, String reason) {
        inStore("pause run " + runId, () -> {
            if (step != null) {
                StepRecord record = loadStep(runId, step);
                if (record.getStatus() == ExecutionStatus.RUNNING) {
                    record.setStatus(ExecutionStatus.PAUSED);
                    record.setErrorMessage(reason);
                    stepRepository.save(record);
                }
            }
            PipelineRun run = loadRun(runId);
            transition("run " + runId, run.getStatus(), ExecutionStatus.PAUSED);
            run.setStatus(ExecutionStatus.PAUSED);
            return runRepository.save(run);
        });
        log.info("⏸️ Run {} paused at step {}: {}", runId, step, reason);
    }

    /**
     * Pause a run left running by a process that no longer executes it, so it can be resumed.
     */
    @Transactional
    public boolean pauseStale(String runId) {
        return inStore("pause stale run " + runId, () -> {
            PipelineRun run = loadRun(runId);
            if (run.getStatus() != ExecutionStatus.RUNNING) {
                return false;
            }
            for (StepRecord record : stepRepository.findByRunIdOrderByStepOrderAsc(runId)) {
                if (record.getStatus() == ExecutionStatus.RUNNING) {
                    record.setStatus(ExecutionStatus.PAUSED);
                    record.setErrorMessage("Interrupted: run was not active in any process");
                    stepRepository.save(record);
                }
            }
            run.setStatus(ExecutionStatus.PAUSED);
            runRepository.save(run);
            log.warn("🩹 Recovered stale run {}: running -> paused", runId);
            return true;
        });
    }

    @Transactional
    public void completeRun(String runId) {
        inStore("complete run " + runId, () -> {
            PipelineRun run = loadRun(runId);
            transition("run " + runId, run.getStatus(), ExecutionStatus.COMPLETED);
            run.setStatus(ExecutionStatus.COMPLETED);
            run.setCurrentStep(null);
            run.setCompletedAt(now());
            return runRepository.save(run);
        });
        log.info("🏁 Run {} completed", runId);
    }

    /**
     * Re-enter the earliest step that is neither completed nor marked non-resumable. Completed
     * steps are never re-entered. Empty when nothing is left to run.
     */
    @Transactional
    public Optional<PipelineStep> resume(String runId) {
        return inStore("resume run " + runId, () -> {
            PipelineRun run = loadRun(runId);
            if (run.getStatus() == ExecutionStatus.FAILED) {
                throw new IllegalRunTransitionException("Run " + runId + " failed and cannot be resumed; start a new run");
            }
            if (run.getStatus() == ExecutionStatus.COMPLETED) {
                return Optional.<PipelineStep>empty();
            }
            if (run.getStatus() == ExecutionStatus.RUNNING) {
                throw new IllegalRunTransitionException("Run " + runId + " is already running");
            }

            List<StepRecord> steps = stepRepository.findByRunIdOrderByStepOrderAsc(runId);
            Optional<StepRecord> next = steps.stream()
                    .filter(s -> s.getStatus() != ExecutionStatus.COMPLETED && Boolean.TRUE.equals(s.getCanResume()))
                    .findFirst();

            if (next.isEmpty()) {
                boolean allCompleted = steps.stream().allMatch(s -> s.getStatus() == ExecutionStatus.COMPLETED);
                if (allCompleted) {
                    run.setStatus(ExecutionStatus.COMPLETED);
                    run.setCompletedAt(now());
                    run.setCurrentStep(null);
                    runRepository.save(run);
                    log.info("🏁 Run {} had no steps left, marked completed", runId);
                } else {
                    log.warn("⚠️ Run {} has unfinished steps that cannot be resumed", runId);
                }
                return Optional.<PipelineStep>empty();
            }

            transition("run " + runId, run.getStatus(), ExecutionStatus.RUNNING);
            run.setStatus(ExecutionStatus.RUNNING);
            if (run.getStartedAt() == null) {
                run.setStartedAt(now());
            }
            StepRecord record = next.get();
            transition("step " + record.getStep(), record.getStatus(), ExecutionStatus.RUNNING);
            record.setStatus(ExecutionStatus.RUNNING);
            if (record.getStartedAt() == null) {
                record.setStartedAt(now());
            }
            run.setCurrentStep(record.getStep());
            stepRepository.save(record);
            runRepository.save(run);

            log.info("🔄 Resuming run {} at step {}", runId, record.getStep());
            return Optional.of(record.getStep());
        });
    }

    /**
     * Record one committed item. Recording the same item twice is a no-op.
     */
    @Transactional
    public void recordCheckpoint(String runId, PipelineStep step, Long itemId, boolean success) {
        inStore("checkpoint item " + itemId, () -> {
            if (checkpointRepository.existsByRunIdAndStepAndItemId(runId, step, itemId)) {
                return null;
            }
            checkpointRepository.save(StepCheckpoint.builder()
                    .runId(runId)
                    .step(step)
                    .itemId(itemId)
                    .success(success)
                    .committedAt(now())
                    .build());
            StepRecord record = loadStep(runId, step);
            record.setProcessedCount(record.getProcessedCount() + 1);
            if (success) {
                record.setSucceededCount(record.getSucceededCount() + 1);
            } else {
                record.setFailedCount(record.getFailedCount() + 1);
            }
            return stepRepository.save(record);
        });
    }

    @Transactional
    public void recordProgress(String runId, PipelineStep step, int processed, int succeeded, int failed) {
        inStore("record progress of " + step, () -> {
            StepRecord record = loadStep(runId, step);
            record.setProcessedCount(processed);
            record.setSucceededCount(succeeded);
            record.setFailedCount(failed);
            return stepRepository.save(record);
        });
    }

    @Transactional(readOnly = true)
    public Set<Long> committedItems(String runId, PipelineStep step) {
        return inStore("read checkpoint", () -> new HashSet<>(checkpointRepository.findItemIds(runId, step)));
    }

    @Transactional(readOnly = true)
    public boolean isStepCompleted(String runId, PipelineStep step) {
        return inStore("read step " + step, () -> loadStep(runId, step).getStatus() == ExecutionStatus.COMPLETED);
    }

    @Transactional(readOnly = true)
    public boolean hasRunningRun(LocalDate day) {
        return inStore("read runs of " + day, () -> runRepository.existsByDigestDayAndStatus(day, ExecutionStatus.RUNNING));
    }

    @Transactional(readOnly = true)
    public PipelineRun getRun(String runId) {
        return inStore("read run " + runId, () -> loadRun(runId));
    }

    @Transactional(readOnly = true)
    public RunStatusDTO getRunStatus(String runId) {
        return inStore("read run status " + runId, () -> toStatus(loadRun(runId)));
    }

    @Transactional(readOnly = true)
    public List<RunStatusDTO> listIncomplete() {
        return inStore("list incomplete runs", () -> runRepository.findByStatusInOrderByCreatedAtDesc(INCOMPLETE)
                .stream()
                .map(this::toStatus)
                .toList());
    }

    @Transactional(readOnly = true)
    public List<RunStatusDTO> recentRuns() {
        return inStore("list recent runs", () -> runRepository.findTop20ByOrderByCreatedAtDesc()
                .stream()
                .map(this::toStatus)
                .toList());
    }

    /**
     * Delete finished runs created before the retention window, with their steps and checkpoints.
     * Running and paused runs are kept whatever their age.
     */
    @Transactional
    public int cleanup(int runDays) {
        LocalDateTime cutoff = now().minusDays(runDays);
        int deleted = inStore("clean up runs", () -> {
            List<String> runIds = runRepository.findByStatusInAndCreatedAtBefore(FINISHED, cutoff)
                    .stream()
                    .map(PipelineRun::getRunId)
                    .toList();
            if (runIds.isEmpty()) {
                return 0;
            }
            checkpointRepository.deleteByRunIdIn(runIds);
            stepRepository.deleteByRunIdIn(runIds);
            runRepository.deleteAllById(runIds);
            return runIds.size();
        });
        log.info("🧹 Cleaned up {} finished runs created before {}", deleted, cutoff);
        return deleted;
    }

    private PipelineRun failRunInternal(String runId, String errorMessage) {
        PipelineRun run = loadRun(runId);
        if (run.getStatus().canTransitionTo(ExecutionStatus.FAILED)) {
            run.setStatus(ExecutionStatus.FAILED);
            run.setCompletedAt(now());
        }
        run.setErrorMessage(errorMessage);
        return runRepository.save(run);
    }

    private RunStatusDTO toStatus(PipelineRun run) {
        List<StepStatusDTO> steps = stepRepository.findByRunIdOrderByStepOrderAsc(run.getRunId())
                .stream()
                .map(s -> StepStatusDTO.builder()
                        .step(s.getStep())
                        .order(s.getStepOrder())
                        .status(s.getStatus())
                        .processed(s.getProcessedCount())
                        .succeeded(s.getSucceededCount())
                        .failed(s.getFailedCount())
                        .errorMessage(s.getErrorMessage())
                        .startedAt(s.getStartedAt())
                        .completedAt(s.getCompletedAt())
                        .durationSeconds(durationSeconds(s.getStartedAt(), s.getCompletedAt()))
                        .canResume(Boolean.TRUE.equals(s.getCanResume()))
                        .build())
                .toList();

        return RunStatusDTO.builder()
                .runId(run.getRunId())
                .mode(run.getMode())
                .day(run.getDigestDay())
                .status(run.getStatus())
                .currentStep(run.getCurrentStep())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .durationSeconds(durationSeconds(run.getStartedAt(), run.getCompletedAt()))
                .errorMessage(run.getErrorMessage())
                .completedSteps((int) steps.stream().filter(s -> s.getStatus() == ExecutionStatus.COMPLETED).count())
                .totalSteps(steps.size())
                .steps(steps)
                .build();
    }

    private Long durationSeconds(LocalDateTime startedAt, LocalDateTime completedAt) {
        if (startedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt != null ? completedAt : now()).getSeconds();
    }

    private PipelineRun loadRun(String runId) {
        return runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private StepRecord loadStep(String runId, PipelineStep step) {
        return stepRepository.findByRunIdAndStep(runId, step)
                .orElseThrow(() -> new IllegalRunTransitionException("Run " + runId + " has no step " + step));
    }

    private static void transition(String subject, ExecutionStatus from, ExecutionStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalRunTransitionException("Illegal transition of " + subject + ": " + from + " -> " + to);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static <T> T inStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to " + operation, e);
        }
    }
}
