package com.newsdigest.backend.candidate.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate record as supplied by the collector and triage stages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateItemDTO {
    private String title;
    private String contentDigest;
    private String source;
    private Integer authorityTier;
    private Double confidence;
    private Double qualityScore;
    private String topic;
    private LocalDateTime discoveredAt;
}
