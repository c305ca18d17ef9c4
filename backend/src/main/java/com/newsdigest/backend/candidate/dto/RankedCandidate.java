package com.newsdigest.backend.candidate.dto;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RankedCandidate {
    private CandidateItem item;
    private int selectionRank;
}
