package com.newsdigest.backend.signature.service;

import static com.newsdigest.backend.support.Candidates.DAY;
import static com.newsdigest.backend.support.Candidates.candidate;
import static com.newsdigest.backend.support.Candidates.withId;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.exception.ComparisonServiceUnavailableException;
import com.newsdigest.backend.exception.StepInterruptedException;
import com.newsdigest.backend.exception.TransientExternalException;
import com.newsdigest.backend.pipeline.service.BatchControl;
import com.newsdigest.backend.signature.dto.DeduplicationOutcome;
import com.newsdigest.backend.signature.dto.TopicComparisonResult;
import com.newsdigest.backend.signature.entity.DedupVerdict;
import com.newsdigest.backend.signature.entity.DeduplicationDecision;
import com.newsdigest.backend.signature.entity.TopicSignature;
import com.newsdigest.backend.signature.repository.DeduplicationDecisionRepository;
import com.newsdigest.backend.signature.repository.TopicSignatureRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class CrossRunDeduplicatorTest {

    @Autowired
    private TopicSignatureRepository signatureRepository;

    @Autowired
    private DeduplicationDecisionRepository decisionRepository;

    @Autowired
    private CandidateItemRepository candidateRepository;

    private final TopicComparisonService comparisonService = mock(TopicComparisonService.class);
    private final DedupProperties properties = new DedupProperties();
    private SignatureStore signatureStore;
    private DecisionLog decisionLog;
    private CrossRunDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(DAY.atTime(18, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        properties.getCrossRun().setMaxConcurrentComparisons(1);
        signatureStore = new SignatureStore(signatureRepository, properties, clock);
        decisionLog = new DecisionLog(decisionRepository, clock);
        DedupLedger ledger = new DedupLedger(signatureStore, decisionLog, candidateRepository);
        deduplicator = new CrossRunDeduplicator(signatureStore, ledger, comparisonService, properties, Runnable::run);
    }

    @Test
    @DisplayName("The first run of a day keeps everything and never calls the comparison service")
    void firstRunOfTheDay() {
        List<CandidateItem> batch = persist(4);

        DeduplicationOutcome outcome = deduplicator.deduplicate(DAY, batch, "run-1", BatchControl.NONE);

        assertTrue(outcome.isFirstRun());
        assertEquals(4, outcome.getUnique().size());
        assertTrue(outcome.getDuplicates().isEmpty());
        assertEquals(1, outcome.getRunSequence());
        assertEquals(4, signatureRepository.countByDigestDay(DAY));
        assertEquals(4, decisionLog.count(DAY, DedupVerdict.UNIQUE));
        assertTrue(batch.stream().allMatch(c -> c.getStatus() == CandidateStatus.UNIQUE));
        verifyNoInteractions(comparisonService);
    }

    @Test
    void laterRunSuppressesStoriesAlreadyCovered() {
        List<String> priorIds = priorSignatures(5);
        List<CandidateItem> batch = persist(7);
        Map<Long, String> expected = new HashMap<>();
        expected.put(batch.get(1).getId(), priorIds.get(0));
        expected.put(batch.get(3).getId(), priorIds.get(2));
        expected.put(batch.get(6).getId(), priorIds.get(4));
        when(comparisonService.compare(any(CandidateItem.class), anyList())).thenAnswer(invocation -> {
            CandidateItem item = invocation.getArgument(0);
            String match = expected.get(item.getId());
            return match != null ? TopicComparisonResult.duplicate(match, 0.9) : TopicComparisonResult.unique(0.1);
        });

        DeduplicationOutcome outcome = deduplicator.deduplicate(DAY, batch, "run-2", BatchControl.NONE);

        assertFalse(outcome.isFirstRun());
        assertEquals(7, outcome.getProcessed());
        assertEquals(expected, outcome.getDuplicates());
        assertEquals(4, outcome.getUnique().size());
        assertEquals(3.0 / 7, outcome.rate(), 1e-9);
        assertEquals(2, outcome.getRunSequence());

        List<TopicSignature> signatures = signatureStore.get(DAY);
        assertEquals(9, signatures.size());
        assertEquals(4, signatures.stream().filter(s -> s.getRunSequence() == 2).count());

        CandidateItem repeated = batch.get(3);
        assertEquals(CandidateStatus.CROSS_RUN_DUPLICATE, repeated.getStatus());
        assertEquals(priorIds.get(2), repeated.getMatchedSignatureId());
        assertEquals(3, decisionLog.count(DAY, DedupVerdict.DUPLICATE));
    }

    @Test
    void comparisonWindowIsLimitedToTheMostRecentSignatures() {
        properties.getCrossRun().setComparisonWindow(2);
        List<String> priorIds = priorSignatures(5);
        List<List<String>> windows = new ArrayList<>();
        when(comparisonService.compare(any(CandidateItem.class), anyList())).thenAnswer(invocation -> {
            List<TopicSignature> window = invocation.getArgument(1);
            windows.add(window.stream().map(TopicSignature::getSignatureId).toList());
            return TopicComparisonResult.unique(0.2);
        });

        deduplicator.deduplicate(DAY, persist(1), "run-2", BatchControl.NONE);

        assertEquals(List.of(List.of(priorIds.get(3), priorIds.get(4))), windows);
    }

    @Test
    @DisplayName("Repeated transient failures keep items as unique and flag every decision")
    void transientFailuresFailOpen() {
        priorSignatures(2);
        List<CandidateItem> batch = persist(5);
        when(comparisonService.compare(any(CandidateItem.class), anyList()))
                .thenThrow(new TransientExternalException("HTTP 500"));

        DeduplicationOutcome outcome = deduplicator.deduplicate(DAY, batch, "run-2", BatchControl.NONE);

        assertEquals(5, outcome.getUnique().size());
        assertTrue(outcome.getDuplicates().isEmpty());
        assertEquals(5, outcome.getErrorCount());
        assertTrue(outcome.isDegraded());
        // Three consecutive failures switch the rest of the batch to pass-through
        verify(comparisonService, times(3)).compare(any(CandidateItem.class), anyList());
        List<DeduplicationDecision> decisions = decisionLog.forRun("run-2");
        assertEquals(5, decisions.size());
        assertTrue(decisions.stream().allMatch(DeduplicationDecision::isErrorFlag));
        assertTrue(decisions.stream().allMatch(d -> d.getDecision() == DedupVerdict.UNIQUE));
    }

    @Test
    void unreachableServiceDegradesToPassThrough() {
        priorSignatures(2);
        List<CandidateItem> batch = persist(4);
        when(comparisonService.compare(any(CandidateItem.class), anyList()))
                .thenThrow(new ComparisonServiceUnavailableException("Connection refused"));

        DeduplicationOutcome outcome = deduplicator.deduplicate(DAY, batch, "run-2", BatchControl.NONE);

        assertTrue(outcome.isDegraded());
        assertEquals(4, outcome.getUnique().size());
        assertEquals(4, outcome.getErrorCount());
        verify(comparisonService, times(1)).compare(any(CandidateItem.class), anyList());
        assertEquals(6, signatureRepository.countByDigestDay(DAY));
    }

    @Test
    @DisplayName("A stopped dedup resumes without re-judging committed items")
    void stopAndResumeSkipsCommittedItems() {
        priorSignatures(3);
        List<CandidateItem> batch = persist(6);
        when(comparisonService.compare(any(CandidateItem.class), anyList())).thenReturn(TopicComparisonResult.unique(0.3));

        RecordingControl first = new RecordingControl(Set.of(), 2);
        assertThrows(StepInterruptedException.class, () -> deduplicator.deduplicate(DAY, batch, "run-2", first));
        assertEquals(2, first.committed.size());

        RecordingControl second = new RecordingControl(first.committed, Integer.MAX_VALUE);
        DeduplicationOutcome outcome = deduplicator.deduplicate(DAY, batch, "run-2", second);

        assertEquals(2, outcome.getSkippedCommitted());
        assertEquals(4, outcome.getProcessed());
        assertEquals(2, outcome.getRunSequence());
        verify(comparisonService, times(6)).compare(any(CandidateItem.class), anyList());
        assertEquals(6, decisionLog.forRun("run-2").size());
        assertEquals(9, signatureRepository.countByDigestDay(DAY));
    }

    @Test
    @DisplayName("The comparison timeout bounds a whole chunk, not each item waited on in turn")
    void timeoutIsSharedByTheChunk() {
        properties.getCrossRun().setMaxConcurrentComparisons(3);
        properties.getCrossRun().setComparisonTimeout(Duration.ofMillis(300));
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CrossRunDeduplicator concurrent = new CrossRunDeduplicator(signatureStore,
                new DedupLedger(signatureStore, decisionLog, candidateRepository), comparisonService, properties, pool);
        priorSignatures(2);
        List<CandidateItem> batch = persist(3);
        Map<Long, Long> delays = Map.of(batch.get(0).getId(), 50L, batch.get(1).getId(), 150L, batch.get(2).getId(), 400L);
        when(comparisonService.compare(any(CandidateItem.class), anyList())).thenAnswer(invocation -> {
            CandidateItem item = invocation.getArgument(0);
            Thread.sleep(delays.get(item.getId()));
            return TopicComparisonResult.unique(0.2);
        });

        try {
            DeduplicationOutcome outcome = concurrent.deduplicate(DAY, batch, "run-2", BatchControl.NONE);

            assertEquals(3, outcome.getUnique().size());
            assertEquals(1, outcome.getErrorCount());
            assertFalse(outcome.isDegraded());
            Map<Long, DeduplicationDecision> byItem = new HashMap<>();
            decisionLog.forRun("run-2").forEach(d -> byItem.put(d.getItemId(), d));
            assertFalse(byItem.get(batch.get(0).getId()).isErrorFlag());
            assertFalse(byItem.get(batch.get(1).getId()).isErrorFlag());
            assertTrue(byItem.get(batch.get(2).getId()).isErrorFlag());
        } finally {
            pool.shutdownNow();
        }
    }

    private List<String> priorSignatures(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> signatureStore.store(withId(90_000L + i, "Earlier story " + i), DAY, 1, "run-1"))
                .toList();
    }

    private List<CandidateItem> persist(int count) {
        List<CandidateItem> batch = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            CandidateItem item = candidate("Story number " + i).build();
            item.setStatus(CandidateStatus.SELECTED);
            item.setPipelineRunId("run-2");
            batch.add(candidateRepository.save(item));
        }
        return batch;
    }

    private static class RecordingControl implements BatchControl {
        private final Set<Long> committed;
        private final int stopAfter;

        RecordingControl(Set<Long> alreadyCommitted, int stopAfter) {
            this.committed = new HashSet<>(alreadyCommitted);
            this.stopAfter = stopAfter;
        }

        @Override
        public String runId() {
            return "run-2";
        }

        @Override
        public boolean stopRequested() {
            return committed.size() >= stopAfter;
        }

        @Override
        public boolean isCommitted(Long itemId) {
            return committed.contains(itemId);
        }

        @Override
        public void committed(Long itemId, boolean success) {
            committed.add(itemId);
        }
    }
}
