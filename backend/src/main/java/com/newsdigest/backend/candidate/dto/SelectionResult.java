package com.newsdigest.backend.candidate.dto;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Ranked working set plus the near-miss set, which exists for reporting only.
 */
@Data
@AllArgsConstructor
public class SelectionResult {
    private List<RankedCandidate> selected;
    private List<CandidateItem> nearMisses;
    private List<CandidateItem> rejected;
    private double threshold;
    private int maxCount;

    public List<Long> selectedIds() {
        return selected.stream().map(r -> r.getItem().getId()).toList();
    }
}
