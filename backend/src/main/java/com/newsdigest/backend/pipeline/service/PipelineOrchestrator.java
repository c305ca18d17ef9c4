package com.newsdigest.backend.pipeline.service;

import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.exception.IllegalRunTransitionException;
import com.newsdigest.backend.exception.StateStoreException;
import com.newsdigest.backend.exception.StepInterruptedException;
import com.newsdigest.backend.pipeline.dto.RunState;
import com.newsdigest.backend.pipeline.dto.RunStatusDTO;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.service.handler.PipelineStepHandler;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Runs the declared steps of a pipeline run one after another. Each active run carries its own
 * {@link RunState}; the stop signal is checked between steps and, inside a step, between items.
 * At most one run per digest day executes at a time.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final RunStateMachine stateMachine;
    private final Map<PipelineStep, PipelineStepHandler> handlers = new EnumMap<>(PipelineStep.class);
    private final Executor pipelineExecutor;
    private final Map<String, RunState> activeRuns = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();

    public PipelineOrchestrator(RunStateMachine stateMachine,
                                List<PipelineStepHandler> stepHandlers,
                                @Qualifier("pipelineTaskExecutor") Executor pipelineExecutor) {
        this.stateMachine = stateMachine;
        this.pipelineExecutor = pipelineExecutor;
        for (PipelineStepHandler handler : stepHandlers) {
            if (handlers.put(handler.step(), handler) != null) {
                throw new IllegalStateException("Two handlers registered for step " + handler.step());
            }
        }
    }

    /**
     * Create and execute a run on the calling thread.
     */
    public RunStatusDTO runPipeline(PipelineMode mode, LocalDate day) {
        RunState state = admit(mode, day);
        try {
            stateMachine.markRunning(state.getRunId());
        } catch (RuntimeException e) {
            activeRuns.remove(state.getRunId());
            throw e;
        }
        execute(state, PipelineStep.COLLECTION);
        return stateMachine.getRunStatus(state.getRunId());
    }

    /**
     * Create a run and execute it on the pipeline executor. Returns the pending run.
     */
    public RunStatusDTO startPipeline(PipelineMode mode, LocalDate day) {
        RunState state = admit(mode, day);
        try {
            pipelineExecutor.execute(() -> {
                try {
                    stateMachine.markRunning(state.getRunId());
                    execute(state, PipelineStep.COLLECTION);
                } catch (RuntimeException e) {
                    activeRuns.remove(state.getRunId());
                    log.error("❌ Pipeline run {} could not start: {}", state.getRunId(), e.getMessage(), e);
                }
            });
        } catch (RuntimeException e) {
            activeRuns.remove(state.getRunId());
            stateMachine.failRun(state.getRunId(), "Could not be scheduled: " + e.getMessage());
            throw e;
        }
        log.info("🚀 Pipeline run {} submitted ({} mode, day {})", state.getRunId(), mode, day);
        return stateMachine.getRunStatus(state.getRunId());
    }

    /**
     * Resume a paused run on the calling thread, starting at the step the state machine picks.
     * A run left running by a dead process is paused first.
     */
    public Optional<PipelineStep> resume(String runId) {
        Optional<PipelineStep> next = prepareResume(runId);
        next.ifPresent(step -> execute(activeRuns.get(runId), step));
        return next;
    }

    public Optional<PipelineStep> resumeAsync(String runId) {
        Optional<PipelineStep> next = prepareResume(runId);
        if (next.isPresent()) {
            RunState state = activeRuns.get(runId);
            try {
                pipelineExecutor.execute(() -> execute(state, next.get()));
            } catch (RuntimeException e) {
                activeRuns.remove(runId);
                stateMachine.pause(runId, next.get(), "Could not be scheduled: " + e.getMessage());
                throw e;
            }
        }
        return next;
    }

    /**
     * Ask an active run to stop. It pauses at the next item or step boundary.
     */
    public boolean requestStop(String runId) {
        RunState state = activeRuns.get(runId);
        if (state == null) {
            log.info("Stop requested for run {} which is not active", runId);
            return false;
        }
        state.requestStop();
        log.info("🛑 Stop requested for run {}", runId);
        return true;
    }

    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }

    /**
     * Refuse to run anything for a day another run is still writing to. A run left running in the
     * store by a dead process blocks the day until it is resumed.
     */
    private void ensureDayIsFree(LocalDate day) {
        if (day == null) {
            return;
        }
        boolean activeHere = activeRuns.values().stream().anyMatch(state -> day.equals(state.getDay()));
        if (activeHere || stateMachine.hasRunningRun(day)) {
            throw new IllegalRunTransitionException("A pipeline run for " + day + " is already running");
        }
    }

    private RunState admit(PipelineMode mode, LocalDate day) {
        synchronized (admissionLock) {
            ensureDayIsFree(day);
            RunState state = stateMachine.createRun(mode, day);
            activeRuns.put(state.getRunId(), state);
            return state;
        }
    }

    // On success the run is registered as active before its first step executes
    private Optional<PipelineStep> prepareResume(String runId) {
        synchronized (admissionLock) {
            if (activeRuns.containsKey(runId)) {
                throw new IllegalRunTransitionException("Run " + runId + " is already executing");
            }
            stateMachine.pauseStale(runId);
            RunState state = stateMachine.stateOf(runId);
            ensureDayIsFree(state.getDay());
            Optional<PipelineStep> next = stateMachine.resume(runId);
            next.ifPresent(step -> activeRuns.put(runId, state));
            return next;
        }
    }

    private void execute(RunState state, PipelineStep from) {
        String runId = state.getRunId();
        activeRuns.put(runId, state);
        PipelineStep current = null;
        try {
            for (PipelineStep step : PipelineStep.ordered()) {
                if (step.getOrder() < from.getOrder() || stateMachine.isStepCompleted(runId, step)) {
                    continue;
                }
                if (state.isStopRequested()) {
                    stateMachine.pause(runId, null, "Stop requested before " + step);
                    return;
                }

                current = step;
                stateMachine.enterStep(runId, step);
                PipelineStepHandler handler = handlers.get(step);
                if (handler == null) {
                    log.info("⏭️ Run {}: step {} is handled upstream, nothing to do", runId, step);
                } else {
                    Set<Long> committed = stateMachine.committedItems(runId, step);
                    handler.execute(new StepContext(state, step, stateMachine, committed));
                }
                stateMachine.completeStep(runId, step);
            }
            current = null;
            stateMachine.completeRun(runId);
        } catch (StepInterruptedException e) {
            stateMachine.pause(runId, current, e.getMessage());
        } catch (StateStoreException | DataAccessException | TransactionException e) {
            log.error("💥 Run {}: state store failure in step {}", runId, current, e);
            failQuietly(runId, current, "State store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Run {}: step {} failed", runId, current, e);
            failQuietly(runId, current, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            activeRuns.remove(runId);
        }
    }

    // The store may be the thing that failed; the run is then left running and recovered on resume
    private void failQuietly(String runId, PipelineStep step, String message) {
        try {
            if (step != null) {
                stateMachine.failStep(runId, step, message);
            } else {
                stateMachine.failRun(runId, message);
            }
        } catch (RuntimeException e) {
            log.error("❌ Could not record failure of run {}: {}", runId, e.getMessage());
        }
    }
}
