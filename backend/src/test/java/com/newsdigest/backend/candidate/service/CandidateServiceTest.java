package com.newsdigest.backend.candidate.service;

import static com.newsdigest.backend.support.Candidates.DAY;
import static com.newsdigest.backend.support.Candidates.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.newsdigest.backend.candidate.dto.CandidateItemDTO;
import com.newsdigest.backend.candidate.dto.IntakeResultDTO;
import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.config.DedupProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class CandidateServiceTest {

    @Autowired
    private CandidateItemRepository candidateRepository;

    private CandidateService candidateService;

    @BeforeEach
    void setUp() {
        candidateService = new CandidateService(candidateRepository, new SelectionRanker(new DedupProperties()));
    }

    @Test
    @DisplayName("Malformed candidates are skipped with a reason and the rest of the batch is stored")
    void intakeSkipsMalformedCandidates() {
        CandidateItemDTO noTitle = dto("  ", 0.8);
        CandidateItemDTO badConfidence = dto("Budget vote delayed", 1.5);

        IntakeResultDTO result = candidateService.intake(Arrays.asList(
                dto("Rail strike called off", 0.8), noTitle, dto("Harbour expansion approved", 0.6), badConfidence, null));

        assertEquals(2, result.getAcceptedIds().size());
        assertEquals(List.of(1, 3, 4), result.getSkipped().stream().map(IntakeResultDTO.SkippedCandidate::getIndex).toList());
        assertTrue(result.getSkipped().get(1).getReason().contains("Confidence"));

        CandidateItem stored = candidateRepository.findById(result.getAcceptedIds().get(0)).orElseThrow();
        assertEquals(CandidateStatus.COLLECTED, stored.getStatus());
        assertEquals(DAY, stored.getDigestDay());
        assertEquals(32, stored.getFingerprint().length());
    }

    @Test
    void selectionMarksEveryCollectedCandidate() {
        List<Long> ids = candidateService.intake(List.of(
                dto("Lead story", 0.90),
                dto("Second story", 0.80),
                dto("Crowded out", 0.75),
                dto("Almost made it", 0.65),
                dto("Weak signal", 0.30))).getAcceptedIds();

        candidateService.applySelection(DAY, "run-1", 0.70, 2);

        List<CandidateItem> selected = candidateService.selectedForRun("run-1");
        assertEquals(List.of(ids.get(0), ids.get(1)), selected.stream().map(CandidateItem::getId).toList());
        assertEquals(2, selected.get(1).getSelectionRank());

        CandidateItem crowdedOut = candidateRepository.findById(ids.get(2)).orElseThrow();
        assertEquals(CandidateStatus.NOT_SELECTED, crowdedOut.getStatus());
        assertEquals("Outside the top 2", crowdedOut.getExclusionReason());
        assertEquals(CandidateStatus.NEAR_MISS, candidateRepository.findById(ids.get(3)).orElseThrow().getStatus());
        assertEquals(CandidateStatus.NOT_SELECTED, candidateRepository.findById(ids.get(4)).orElseThrow().getStatus());
    }

    @Test
    @SuppressWarnings("unchecked")
    void selectionReportShowsFunnelAndNearMisses() {
        candidateService.intake(List.of(dto("Kept", 0.95), dto("Near", 0.62), dto("Dropped", 0.10)));
        candidateService.applySelection(DAY, "run-7", 0.70, 5);

        Map<String, Object> report = candidateService.selectionReport("run-7");

        Map<String, Long> funnel = (Map<String, Long>) report.get("funnel");
        assertEquals(1L, funnel.get("SELECTED"));
        assertEquals(1L, funnel.get("NEAR_MISS"));
        assertEquals(1L, funnel.get("NOT_SELECTED"));
        assertEquals(0L, funnel.get("UNIQUE"));
        assertEquals(0.95, report.get("lowestSelectedConfidence"));
        List<Map<String, Object>> nearMisses = (List<Map<String, Object>>) report.get("nearMisses");
        assertEquals("Near", nearMisses.get(0).get("title"));
    }

    @Test
    void selectionOnlyConsidersTheRequestedDay() {
        List<CandidateItemDTO> batch = new ArrayList<>();
        batch.add(dto("Today", 0.9));
        CandidateItemDTO yesterday = dto("Yesterday", 0.9);
        yesterday.setDiscoveredAt(DAY.minusDays(1).atTime(22, 0));
        batch.add(yesterday);
        candidateService.intake(batch);

        candidateService.applySelection(DAY, "run-1", 0.5, 10);

        assertEquals(1, candidateService.selectedForRun("run-1").size());
        assertEquals(1, candidateService.forDay(DAY.minusDays(1), List.of(CandidateStatus.COLLECTED)).size());
    }

    private static CandidateItemDTO dto(String title, double confidence) {
        return CandidateItemDTO.builder()
                .title(title)
                .contentDigest(title + " in detail")
                .source("wire")
                .authorityTier(3)
                .confidence(confidence)
                .qualityScore(0.7)
                .topic("politics")
                .discoveredAt(at(7, 30))
                .build();
    }
}
