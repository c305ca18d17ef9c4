package com.newsdigest.backend.pipeline.service.handler;

import com.newsdigest.backend.candidate.dto.SelectionResult;
import com.newsdigest.backend.candidate.service.CandidateService;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.service.StepContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FilteringStepHandler implements PipelineStepHandler {

    private final CandidateService candidateService;

    @Override
    public PipelineStep step() {
        return PipelineStep.FILTERING;
    }

    @Override
    public void execute(StepContext context) {
        context.checkStop();
        DedupProperties.ModeSettings settings = context.getSettings();
        SelectionResult result = candidateService.applySelection(
                context.getDay(), context.runId(), settings.getConfidenceThreshold(), settings.getMaxCount());

        int total = result.getSelected().size() + result.getNearMisses().size() + result.getRejected().size();
        context.recordProgress(total, result.getSelected().size(), 0);
        log.info("🎯 Run {}: {} of {} candidates selected, {} near misses",
                context.runId(), result.getSelected().size(), total, result.getNearMisses().size());
    }
}
