package com.newsdigest.backend.candidate.service;

import com.newsdigest.backend.candidate.dto.RankedCandidate;
import com.newsdigest.backend.candidate.dto.SelectionResult;
import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bounds the expensive part of the pipeline to the top-N candidates by triage confidence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SelectionRanker {

    // Confidence descending; List.sort is stable so equal confidences keep input order
    private static final Comparator<CandidateItem> BY_CONFIDENCE_DESC =
            Comparator.comparing(CandidateItem::getConfidence, Comparator.reverseOrder());

    private final DedupProperties dedupProperties;

    public SelectionResult select(List<CandidateItem> candidates, double threshold, int maxCount) {
        return select(candidates, threshold, maxCount, dedupProperties.getSelection().getNearMissMargin());
    }

    /**
     * Keep every candidate with confidence >= threshold, best first, truncated to maxCount and
     * ranked from 1. Candidates within nearMissMargin below the threshold are reported separately
     * and never selected.
     */
    public SelectionResult select(List<CandidateItem> candidates, double threshold, int maxCount, double nearMissMargin) {
        DedupProperties.requireUnitInterval("threshold", threshold);
        DedupProperties.requireUnitInterval("nearMissMargin", nearMissMargin);
        if (maxCount < 1) {
            throw new InvalidConfigurationException("maxCount must be positive but was " + maxCount);
        }

        List<CandidateItem> sorted = new ArrayList<>(candidates);
        sorted.sort(BY_CONFIDENCE_DESC);

        List<RankedCandidate> selected = new ArrayList<>();
        List<CandidateItem> nearMisses = new ArrayList<>();
        List<CandidateItem> rejected = new ArrayList<>();
        double nearMissFloor = threshold - nearMissMargin;

        for (CandidateItem candidate : sorted) {
            double confidence = candidate.getConfidence();
            if (confidence >= threshold) {
                if (selected.size() < maxCount) {
                    selected.add(new RankedCandidate(candidate, selected.size() + 1));
                } else {
                    rejected.add(candidate);
                }
            } else if (confidence >= nearMissFloor) {
                nearMisses.add(candidate);
            } else {
                rejected.add(candidate);
            }
        }

        log.info("🎯 Selected {}/{} candidates (threshold {}, max {}), {} near misses",
                selected.size(), candidates.size(), threshold, maxCount, nearMisses.size());
        return new SelectionResult(selected, nearMisses, rejected, threshold, maxCount);
    }
}
