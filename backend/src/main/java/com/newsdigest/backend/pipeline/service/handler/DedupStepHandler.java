package com.newsdigest.backend.pipeline.service.handler;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.service.CandidateService;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.service.StepContext;
import com.newsdigest.backend.signature.dto.DeduplicationReport;
import com.newsdigest.backend.signature.service.DeduplicationService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Clusters the run's selected candidates, then suppresses stories already covered earlier today.
 * Items committed before an interruption are no longer SELECTED and are not reloaded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupStepHandler implements PipelineStepHandler {

    private final CandidateService candidateService;
    private final DeduplicationService deduplicationService;

    @Override
    public PipelineStep step() {
        return PipelineStep.DEDUP;
    }

    @Override
    public void execute(StepContext context) {
        List<CandidateItem> batch = candidateService.selectedForRun(context.runId());
        DeduplicationReport report = deduplicationService.deduplicate(
                context.getDay(), batch, context.getSettings().getSimilarityThreshold(), context.runId(), context);

        log.info("🧬 Run {}: dedup {}", context.runId(), report.summary());
        if (report.getCrossRun().isDegraded()) {
            log.warn("⚠️ Run {}: comparison service unavailable, cross-run dedup degraded to pass-through", context.runId());
        }
    }
}
