package com.newsdigest.backend.signature.service;

import static com.newsdigest.backend.support.Candidates.DAY;
import static com.newsdigest.backend.support.Candidates.withId;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.cluster.dto.ClusteringResult;
import com.newsdigest.backend.cluster.entity.DuplicateCluster;
import com.newsdigest.backend.cluster.service.ClusterService;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.exception.IllegalRunTransitionException;
import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.service.BatchControl;
import com.newsdigest.backend.pipeline.service.RunStateMachine;
import com.newsdigest.backend.signature.dto.DeduplicationOutcome;
import com.newsdigest.backend.signature.dto.DeduplicationReport;
import com.newsdigest.backend.similarity.SimilarityMethod;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class DeduplicationServiceTest {

    private final ClusterService clusterService = mock(ClusterService.class);
    private final CrossRunDeduplicator crossRunDeduplicator = mock(CrossRunDeduplicator.class);
    private final CandidateItemRepository candidateRepository = mock(CandidateItemRepository.class);
    private final RunStateMachine runStateMachine = mock(RunStateMachine.class);
    private final DeduplicationService service = new DeduplicationService(
            clusterService, crossRunDeduplicator, candidateRepository, runStateMachine, new DedupProperties());

    @Test
    @SuppressWarnings("unchecked")
    void onlyClusterPrimariesReachCrossRunDedup() {
        CandidateItem first = withId(1, "Dam failure floods valley");
        CandidateItem second = withId(2, "Valley flooded after dam fails");
        CandidateItem third = withId(3, "Chess final goes to tiebreak");
        when(clusterService.clusterAndPersist(anyList(), anyDouble(), eq("run-1"))).thenAnswer(invocation -> {
            second.markDuplicate(CandidateStatus.BATCH_DUPLICATE, "Same story as item 1");
            DuplicateCluster cluster = DuplicateCluster.builder()
                    .clusterId("c-1")
                    .memberIds(new LinkedHashSet<>(Set.of(1L, 2L)))
                    .primaryItemId(1L)
                    .clusteringMethod(SimilarityMethod.TFIDF)
                    .similarityThreshold(0.8)
                    .build();
            return new ClusteringResult(List.of(cluster), List.of(1L, 3L), SimilarityMethod.TFIDF);
        });
        when(crossRunDeduplicator.deduplicate(eq(DAY), anyList(), eq("run-1"), any(BatchControl.class)))
                .thenReturn(outcome(Map.of(3L, "sig-9"), List.of(1L)));

        DeduplicationReport report = service.deduplicate(DAY, List.of(third, second, first), 0.8, "run-1", BatchControl.NONE);

        ArgumentCaptor<List<CandidateItem>> survivors = ArgumentCaptor.forClass(List.class);
        verify(crossRunDeduplicator).deduplicate(eq(DAY), survivors.capture(), eq("run-1"), any(BatchControl.class));
        assertEquals(List.of(1L, 3L), survivors.getValue().stream().map(CandidateItem::getId).toList());
        assertEquals(3, report.getProcessed());
        assertEquals(2, report.duplicates());
        assertEquals(1, report.unique());
        assertEquals(0.667, report.summary().get("rate"));
    }

    @Test
    void persistedClustersAreNotRebuiltOnResume() {
        CandidateItem first = withId(1, "Dam failure floods valley");
        when(clusterService.hasClusters("run-1")).thenReturn(true);
        when(crossRunDeduplicator.deduplicate(eq(DAY), anyList(), eq("run-1"), any(BatchControl.class)))
                .thenReturn(outcome(Map.of(), List.of(1L)));

        DeduplicationReport report = service.deduplicate(DAY, List.of(first), 0.8, "run-1", BatchControl.NONE);

        verify(clusterService, never()).clusterAndPersist(anyList(), anyDouble(), anyString());
        assertEquals(0, report.getBatchDuplicates());
    }

    @Test
    @DisplayName("A manual trigger is refused while a run for the day is executing")
    void triggerRefusedWhileRunIsRunning() {
        when(runStateMachine.hasRunningRun(DAY)).thenReturn(true);

        assertThrows(IllegalRunTransitionException.class, () -> service.triggerDedup(DAY));

        verifyNoInteractions(candidateRepository, clusterService, crossRunDeduplicator);
    }

    @Test
    @DisplayName("A manual trigger only takes candidates no resumable run owns and records them under no run")
    void triggerTakesUnownedCandidatesOnly() {
        CandidateItem orphan = withId(7, "Ferry strike called off");
        when(candidateRepository.findUnownedByDigestDayAndStatus(DAY, CandidateStatus.SELECTED, ExecutionStatus.FAILED))
                .thenReturn(List.of(orphan));
        when(clusterService.clusterAndPersist(anyList(), anyDouble(), isNull()))
                .thenReturn(new ClusteringResult(List.of(), List.of(7L), SimilarityMethod.TFIDF));
        when(crossRunDeduplicator.deduplicate(eq(DAY), anyList(), isNull(), any(BatchControl.class)))
                .thenReturn(outcome(Map.of(), List.of(7L)));

        Map<String, Object> summary = service.triggerDedup(DAY);

        assertEquals(1, summary.get("processed"));
        assertEquals(1, summary.get("unique"));
        verify(candidateRepository, never()).findByDigestDayAndStatusInOrderByIdAsc(any(), anyList());
    }

    private static DeduplicationOutcome outcome(Map<Long, String> duplicates, List<Long> unique) {
        return DeduplicationOutcome.builder()
                .day(DAY)
                .processed(duplicates.size() + unique.size())
                .duplicates(new LinkedHashMap<>(duplicates))
                .unique(unique)
                .build();
    }
}
