package com.newsdigest.backend.signature.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.exception.StateStoreException;
import com.newsdigest.backend.signature.entity.TopicSignature;
import com.newsdigest.backend.signature.repository.TopicSignatureRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;

/**
 * Day-partitioned store of topic signatures. The day is part of every query, so yesterday's
 * stories stop matching at midnight without any reset job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignatureStore {

    private final TopicSignatureRepository signatureRepository;
    private final DedupProperties dedupProperties;
    private final Clock clock;

    @Transactional
    public String store(CandidateItem item, LocalDate day, int runSequence) {
        return store(item, day, runSequence, item.getPipelineRunId());
    }

    /**
     * Persist a signature for the item and return its id. Storing the same item twice for a day
     * returns the existing signature, so a resumed run cannot create a second one.
     */
    @Transactional
    public String store(CandidateItem item, LocalDate day, int runSequence, String runId) {
        try {
            Optional<TopicSignature> existing = signatureRepository.findByDigestDayAndSourceItemId(day, item.getId());
            if (existing.isPresent()) {
                log.debug("Signature for item {} on {} already stored as {}", item.getId(), day, existing.get().getSignatureId());
                return existing.get().getSignatureId();
            }

            TopicSignature signature = TopicSignature.builder()
                    .signatureId(newSignatureId(day, item.getId()))
                    .digestDay(day)
                    .runSequence(runSequence)
                    .themeLabel(item.getTopic() != null && !item.getTopic().isBlank() ? item.getTopic() : "unknown")
                    .summaryExcerpt(excerpt(item))
                    .sourceItemId(item.getId())
                    .pipelineRunId(runId)
                    .build();
            signatureRepository.save(signature);

            log.debug("Stored topic signature {} for item {} (day {}, run sequence {})",
                    signature.getSignatureId(), item.getId(), day, runSequence);
            return signature.getSignatureId();
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to store topic signature for item " + item.getId(), e);
        }
    }

    /**
     * Signatures of the day ordered by run sequence, then insertion order. Empty when none exist.
     */
    @Transactional(readOnly = true)
    public List<TopicSignature> get(LocalDate day) {
        try {
            List<TopicSignature> signatures = signatureRepository.findByDigestDayOrderByRunSequenceAscIdAsc(day);
            log.debug("Retrieved {} signatures for {}", signatures.size(), day);
            return signatures;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to read topic signatures for " + day, e);
        }
    }

    public Optional<TopicSignature> findBySignatureId(String signatureId) {
        return signatureRepository.findBySignatureId(signatureId);
    }

    /**
     * Run sequence for a run's signatures: the one it already used on this day, otherwise the
     * day's highest plus one.
     */
    @Transactional(readOnly = true)
    public int resolveRunSequence(LocalDate day, String runId) {
        if (runId != null) {
            Optional<TopicSignature> own = signatureRepository.findFirstByDigestDayAndPipelineRunId(day, runId);
            if (own.isPresent()) {
                return own.get().getRunSequence();
            }
        }
        Integer max = signatureRepository.findMaxRunSequence(day);
        return (max != null ? max : 0) + 1;
    }

    /**
     * Delete signatures whose day lies before today minus the retention window.
     */
    @Transactional
    public int cleanup(int retentionDays) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        try {
            int deleted = signatureRepository.deleteByDigestDayBefore(cutoff);
            log.info("🧹 Cleaned up {} signatures older than {} days (before {})", deleted, retentionDays, cutoff);
            return deleted;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to clean up topic signatures before " + cutoff, e);
        }
    }

    private String excerpt(CandidateItem item) {
        String text = item.getContentDigest() != null && !item.getContentDigest().isBlank()
                ? item.getContentDigest()
                : item.getTitle();
        int limit = dedupProperties.getCrossRun().getSummaryExcerptLength();
        return text.length() > limit ? text.substring(0, limit) : text;
    }

    private String newSignatureId(LocalDate day, Long itemId) {
        String key = day + "_" + itemId + "_" + LocalDateTime.now(clock) + "_" + System.nanoTime();
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, 16);
    }
}
