package com.newsdigest.backend.signature.service;

import com.newsdigest.backend.exception.StateStoreException;
import com.newsdigest.backend.signature.entity.DedupVerdict;
import com.newsdigest.backend.signature.entity.DeduplicationDecision;
import com.newsdigest.backend.signature.repository.DeduplicationDecisionRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only audit trail of cross-run decisions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionLog {

    private final DeduplicationDecisionRepository decisionRepository;
    private final Clock clock;

    @Transactional
    public DeduplicationDecision append(DeduplicationDecision decision) {
        try {
            DeduplicationDecision saved = decisionRepository.save(decision);
            if (decision.isErrorFlag()) {
                log.debug("Logged fail-open {} decision for item {}: {}", decision.getDecision(), decision.getItemId(), decision.getErrorMessage());
            }
            return saved;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to log dedup decision for item " + decision.getItemId(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<DeduplicationDecision> forDay(LocalDate day) {
        return decisionRepository.findByDigestDayOrderByIdAsc(day);
    }

    @Transactional(readOnly = true)
    public List<DeduplicationDecision> forRun(String runId) {
        return decisionRepository.findByPipelineRunIdOrderByIdAsc(runId);
    }

    @Transactional(readOnly = true)
    public long count(LocalDate day, DedupVerdict verdict) {
        return decisionRepository.countByDigestDayAndDecision(day, verdict);
    }

    @Transactional
    public int cleanup(int retentionDays) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        try {
            int deleted = decisionRepository.deleteByDigestDayBefore(cutoff);
            log.info("🧹 Cleaned up {} dedup decisions before {}", deleted, cutoff);
            return deleted;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to clean up dedup decisions before " + cutoff, e);
        }
    }
}
