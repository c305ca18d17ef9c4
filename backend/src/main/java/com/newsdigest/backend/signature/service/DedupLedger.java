package com.newsdigest.backend.signature.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.exception.StateStoreException;
import com.newsdigest.backend.signature.entity.DedupVerdict;
import com.newsdigest.backend.signature.entity.DeduplicationDecision;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Commits one candidate's cross-run outcome atomically: decision row, signature (for unique
 * items) and candidate status land together or not at all.
 */
@Service
@RequiredArgsConstructor
public class DedupLedger {

    private final SignatureStore signatureStore;
    private final DecisionLog decisionLog;
    private final CandidateItemRepository candidateRepository;

    @Transactional
    public String recordUnique(CandidateItem item, LocalDate day, int runSequence, String runId,
                               Double confidence, long processingTimeMs, String error) {
        String signatureId = signatureStore.store(item, day, runSequence, runId);
        decisionLog.append(DeduplicationDecision.builder()
                .itemId(item.getId())
                .digestDay(day)
                .decision(DedupVerdict.UNIQUE)
                .confidence(confidence)
                .processingTimeMs(processingTimeMs)
                .errorFlag(error != null)
                .errorMessage(error)
                .pipelineRunId(runId)
                .build());
        item.setStatus(CandidateStatus.UNIQUE);
        saveCandidate(item);
        return signatureId;
    }

    @Transactional
    public void recordDuplicate(CandidateItem item, LocalDate day, String matchedSignatureId, String runId,
                                Double confidence, long processingTimeMs) {
        decisionLog.append(DeduplicationDecision.builder()
                .itemId(item.getId())
                .digestDay(day)
                .decision(DedupVerdict.DUPLICATE)
                .matchedSignatureId(matchedSignatureId)
                .confidence(confidence)
                .processingTimeMs(processingTimeMs)
                .errorFlag(false)
                .pipelineRunId(runId)
                .build());
        item.setMatchedSignatureId(matchedSignatureId);
        item.markDuplicate(CandidateStatus.CROSS_RUN_DUPLICATE, "Topic already covered today by signature " + matchedSignatureId);
        saveCandidate(item);
    }

    private void saveCandidate(CandidateItem item) {
        try {
            candidateRepository.save(item);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to update candidate " + item.getId(), e);
        }
    }
}
