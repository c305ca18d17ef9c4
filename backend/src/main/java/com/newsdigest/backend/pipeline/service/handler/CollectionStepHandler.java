package com.newsdigest.backend.pipeline.service.handler;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.service.CandidateService;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.service.StepContext;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Candidates arrive through the intake endpoint; this step takes stock of what was collected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollectionStepHandler implements PipelineStepHandler {

    private final CandidateService candidateService;

    @Override
    public PipelineStep step() {
        return PipelineStep.COLLECTION;
    }

    @Override
    public void execute(StepContext context) {
        List<CandidateItem> collected = candidateService.forDay(context.getDay(), List.of(CandidateStatus.COLLECTED));
        context.recordProgress(collected.size(), collected.size(), 0);
        log.info("📰 Run {}: {} collected candidates waiting for {}", context.runId(), collected.size(), context.getDay());
    }
}
