package com.newsdigest.backend.startup;

import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.exception.IllegalRunTransitionException;
import com.newsdigest.backend.pipeline.dto.RunStatusDTO;
import com.newsdigest.backend.pipeline.service.PipelineOrchestrator;
import com.newsdigest.backend.pipeline.service.RunStateMachine;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineScheduler {

    private final PipelineOrchestrator orchestrator;
    private final RunStateMachine stateMachine;
    private final RetentionService retentionService;
    private final Clock clock;

    @Value("${app.scheduler.pipeline-enabled:false}")
    private boolean pipelineEnabled;

    @Value("${app.scheduler.pipeline-mode:STANDARD}")
    private String pipelineMode;

    /**
     * Report runs a previous process left unfinished; they resume only on request
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        List<RunStatusDTO> incomplete = stateMachine.listIncomplete();
        if (incomplete.isEmpty()) {
            log.info("🚀 APPLICATION READY - no incomplete pipeline runs");
            return;
        }
        log.warn("⚠️ APPLICATION READY - {} incomplete pipeline runs found", incomplete.size());
        for (RunStatusDTO run : incomplete) {
            log.warn("   ↳ run {} ({}, day {}) is {} at step {}, resume via POST /api/pipeline/runs/{}/resume",
                    run.getRunId(), run.getMode(), run.getDay(), run.getStatus(), run.getCurrentStep(), run.getRunId());
        }
    }

    /**
     * Scheduled pipeline run for today, off unless app.scheduler.pipeline-enabled is set
     */
    @Scheduled(cron = "${app.scheduler.pipeline-cron:0 0 */4 * * *}")
    public void scheduledPipelineExecution() {
        if (!pipelineEnabled) {
            return;
        }
        log.info("⏰ SCHEDULED PIPELINE EXECUTION STARTED");
        try {
            orchestrator.startPipeline(PipelineMode.fromName(pipelineMode), LocalDate.now(clock));
        } catch (IllegalRunTransitionException e) {
            log.warn("⏭️ Scheduled pipeline skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Scheduled pipeline could not start: {}", e.getMessage(), e);
        }
    }

    /**
     * Nightly retention cleanup
     */
    @Scheduled(cron = "${dedup.retention.cleanup-cron:0 30 3 * * *}")
    public void scheduledCleanup() {
        try {
            retentionService.cleanup();
        } catch (RuntimeException e) {
            log.error("❌ Retention cleanup failed: {}", e.getMessage(), e);
        }
    }
}
