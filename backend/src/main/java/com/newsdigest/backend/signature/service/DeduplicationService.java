package com.newsdigest.backend.signature.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.cluster.dto.ClusteringResult;
import com.newsdigest.backend.cluster.service.ClusterService;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.exception.IllegalRunTransitionException;
import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.service.BatchControl;
import com.newsdigest.backend.pipeline.service.RunStateMachine;
import com.newsdigest.backend.signature.dto.DeduplicationOutcome;
import com.newsdigest.backend.signature.dto.DeduplicationReport;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Same-batch clustering followed by cross-run suppression of the survivors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    private final ClusterService clusterService;
    private final CrossRunDeduplicator crossRunDeduplicator;
    private final CandidateItemRepository candidateRepository;
    private final RunStateMachine runStateMachine;
    private final DedupProperties dedupProperties;

    public DeduplicationReport deduplicate(LocalDate day, List<CandidateItem> batch, double similarityThreshold,
                                           String runId, BatchControl control) {
        // Discovery order drives primary tie-breaks
        List<CandidateItem> ordered = batch.stream()
                .sorted(Comparator.comparing(CandidateItem::getId))
                .toList();

        int batchDuplicates = 0;
        List<CandidateItem> survivors = ordered;
        if (clusterService.hasClusters(runId)) {
            log.info("♻️ Clusters for run {} already persisted, skipping same-batch clustering", runId);
        } else {
            ClusteringResult clustering = clusterService.clusterAndPersist(ordered, similarityThreshold, runId);
            batchDuplicates = clustering.duplicateCount();
            survivors = ordered.stream()
                    .filter(item -> item.getStatus() != CandidateStatus.BATCH_DUPLICATE)
                    .toList();
        }

        control.checkStop();
        DeduplicationOutcome crossRun = crossRunDeduplicator.deduplicate(day, survivors, runId, control);
        return new DeduplicationReport(ordered.size(), batchDuplicates, crossRun);
    }

    /**
     * Deduplicate the selected candidates of a day that no resumable run owns: those selected
     * outside a run and those left behind by a failed run. Refused while a run for the day is
     * executing, since that run is the day's only writer.
     */
    public Map<String, Object> triggerDedup(LocalDate day) {
        if (runStateMachine.hasRunningRun(day)) {
            throw new IllegalRunTransitionException("A pipeline run for " + day + " is running; deduplication is left to it");
        }
        List<CandidateItem> selected = candidateRepository.findUnownedByDigestDayAndStatus(
                day, CandidateStatus.SELECTED, ExecutionStatus.FAILED);
        double threshold = dedupProperties.settingsFor(PipelineMode.STANDARD).getSimilarityThreshold();
        log.info("🚀 Triggering deduplication for {} with {} selected candidates", day, selected.size());

        DeduplicationReport report = deduplicate(day, selected, threshold, null, BatchControl.NONE);
        return report.summary();
    }
}
