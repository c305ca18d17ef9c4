package com.newsdigest.backend.candidate.service;

import com.newsdigest.backend.candidate.dto.CandidateItemDTO;
import com.newsdigest.backend.candidate.dto.IntakeResultDTO;
import com.newsdigest.backend.candidate.dto.RankedCandidate;
import com.newsdigest.backend.candidate.dto.SelectionResult;
import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.exception.DataIntegrityException;
import com.newsdigest.backend.exception.StateStoreException;
import com.newsdigest.backend.similarity.TextNormalizer;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateService {

    private final CandidateItemRepository candidateRepository;
    private final SelectionRanker selectionRanker;

    /**
     * Store collected candidates. A malformed record is skipped with its reason; the rest of the
     * batch is still accepted.
     */
    @Transactional
    public IntakeResultDTO intake(List<CandidateItemDTO> candidates) {
        List<Long> accepted = new ArrayList<>();
        List<IntakeResultDTO.SkippedCandidate> skipped = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            CandidateItemDTO dto = candidates.get(i);
            try {
                validateCandidate(dto);
                CandidateItem saved = candidateRepository.save(toEntity(dto));
                accepted.add(saved.getId());
            } catch (DataIntegrityException e) {
                String title = dto != null ? dto.getTitle() : null;
                log.warn("⚠️ Skipping candidate #{} ({}): {}", i, title, e.getMessage());
                skipped.add(new IntakeResultDTO.SkippedCandidate(i, title, e.getMessage()));
            } catch (DataAccessException e) {
                throw new StateStoreException("Failed to store candidate #" + i, e);
            }
        }

        log.info("📥 Accepted {}/{} candidates ({} skipped)", accepted.size(), candidates.size(), skipped.size());
        return new IntakeResultDTO(accepted, skipped);
    }

    /**
     * Rank the day's collected candidates and mark each one selected, near miss or not selected
     * for the run, in one transaction.
     */
    @Transactional
    public SelectionResult applySelection(LocalDate day, String runId, double threshold, int maxCount) {
        List<CandidateItem> collected = candidateRepository.findByDigestDayAndStatusInOrderByIdAsc(day, List.of(CandidateStatus.COLLECTED));
        SelectionResult result = selectionRanker.select(collected, threshold, maxCount);

        try {
            for (RankedCandidate ranked : result.getSelected()) {
                CandidateItem item = ranked.getItem();
                item.setStatus(CandidateStatus.SELECTED);
                item.setSelectionRank(ranked.getSelectionRank());
                item.setPipelineRunId(runId);
            }
            for (CandidateItem item : result.getNearMisses()) {
                item.setStatus(CandidateStatus.NEAR_MISS);
                item.setPipelineRunId(runId);
                item.setExclusionReason(String.format("Confidence %.2f just below threshold %.2f", item.getConfidence(), threshold));
            }
            for (CandidateItem item : result.getRejected()) {
                item.setStatus(CandidateStatus.NOT_SELECTED);
                item.setPipelineRunId(runId);
                item.setExclusionReason(item.getConfidence() >= threshold
                        ? "Outside the top " + maxCount
                        : String.format("Confidence %.2f below threshold %.2f", item.getConfidence(), threshold));
                log.debug("Item {} not selected: {}", item.getId(), item.getExclusionReason());
            }
            candidateRepository.saveAll(collected);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to store selection for run " + runId, e);
        }
        return result;
    }

    /**
     * Selection funnel for a run: counts per status plus the near misses.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> selectionReport(String runId) {
        Map<String, Long> funnel = new LinkedHashMap<>();
        for (CandidateStatus status : CandidateStatus.values()) {
            funnel.put(status.name(), 0L);
        }
        for (Object[] row : candidateRepository.countByStatusForRun(runId)) {
            funnel.put(((CandidateStatus) row[0]).name(), (Long) row[1]);
        }

        List<Map<String, Object>> nearMisses = candidateRepository
                .findByPipelineRunIdAndStatusOrderByConfidenceDesc(runId, CandidateStatus.NEAR_MISS)
                .stream()
                .map(item -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("id", item.getId());
                    entry.put("title", item.getTitle());
                    entry.put("source", item.getSource());
                    entry.put("confidence", item.getConfidence());
                    return entry;
                })
                .toList();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("runId", runId);
        report.put("funnel", funnel);
        report.put("lowestSelectedConfidence", candidateRepository.findLowestSelectedConfidence(runId));
        report.put("nearMisses", nearMisses);
        return report;
    }

    @Transactional(readOnly = true)
    public List<CandidateItem> selectedForRun(String runId) {
        return candidateRepository.findByPipelineRunIdAndStatusOrderBySelectionRankAsc(runId, CandidateStatus.SELECTED);
    }

    @Transactional(readOnly = true)
    public List<CandidateItem> forDay(LocalDate day, List<CandidateStatus> statuses) {
        return candidateRepository.findByDigestDayAndStatusInOrderByIdAsc(day, statuses);
    }

    private void validateCandidate(CandidateItemDTO dto) {
        if (dto == null) {
            throw new DataIntegrityException("candidate", "Candidate cannot be null");
        }
        if (dto.getTitle() == null || dto.getTitle().trim().isEmpty()) {
            throw new DataIntegrityException("title", "Title cannot be null or empty");
        }
        if (dto.getSource() == null || dto.getSource().trim().isEmpty()) {
            throw new DataIntegrityException("source", "Source cannot be null or empty");
        }
        if (dto.getAuthorityTier() == null || dto.getAuthorityTier() < 0) {
            throw new DataIntegrityException("authorityTier", "Authority tier must be a non-negative number");
        }
        if (dto.getConfidence() == null || dto.getConfidence().isNaN() || dto.getConfidence() < 0.0 || dto.getConfidence() > 1.0) {
            throw new DataIntegrityException("confidence", "Confidence must be within [0, 1]");
        }
        if (dto.getQualityScore() != null && (dto.getQualityScore() < 0.0 || dto.getQualityScore() > 1.0)) {
            throw new DataIntegrityException("qualityScore", "Quality score must be within [0, 1]");
        }
        if (dto.getDiscoveredAt() == null) {
            throw new DataIntegrityException("discoveredAt", "Discovery time is required");
        }
    }

    private CandidateItem toEntity(CandidateItemDTO dto) {
        String title = dto.getTitle().trim();
        String source = dto.getSource().trim();
        return CandidateItem.builder()
                .title(title)
                .contentDigest(dto.getContentDigest())
                .source(source)
                .authorityTier(dto.getAuthorityTier())
                .confidence(dto.getConfidence())
                .qualityScore(dto.getQualityScore())
                .topic(dto.getTopic())
                .discoveredAt(dto.getDiscoveredAt())
                .digestDay(dto.getDiscoveredAt().toLocalDate())
                .fingerprint(TextNormalizer.fingerprint(title, source))
                .build();
    }
}
