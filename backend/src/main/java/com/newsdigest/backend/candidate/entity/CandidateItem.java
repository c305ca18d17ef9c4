package com.newsdigest.backend.candidate.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * A collected article. The descriptive fields are fixed at creation; only the processing
 * status columns move as the item flows through the pipeline.
 */
@Getter
@Builder
@ToString(exclude = "contentDigest")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Entity
@Table(name = "candidate_items", indexes = {
        @Index(name = "idx_candidates_day", columnList = "digest_day"),
        @Index(name = "idx_candidates_fingerprint", columnList = "fingerprint")
})
public class CandidateItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String title;

    // Extracted text (or summary) used as similarity input
    @Column(updatable = false, columnDefinition = "TEXT")
    private String contentDigest;

    @Column(nullable = false, updatable = false)
    private String source;

    @Column(nullable = false, updatable = false)
    private Integer authorityTier;

    @Column(nullable = false, updatable = false)
    private Double confidence;

    // Extraction/content quality supplied upstream (0.0 to 1.0)
    @Column(updatable = false)
    private Double qualityScore;

    @Column(length = 200, updatable = false)
    private String topic;

    @Column(nullable = false, updatable = false)
    private LocalDateTime discoveredAt;

    @Column(name = "digest_day", nullable = false, updatable = false)
    private LocalDate digestDay;

    @Column(length = 32, updatable = false)
    private String fingerprint;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private CandidateStatus status = CandidateStatus.COLLECTED;

    @Setter
    private Integer selectionRank;

    @Setter
    @Column(length = 64)
    private String pipelineRunId;

    @Setter
    @Column(length = 64)
    private String clusterId;

    @Setter
    @Column(length = 32)
    private String matchedSignatureId;

    @Setter
    @Column(columnDefinition = "TEXT")
    private String exclusionReason;

    @UpdateTimestamp
    private LocalDateTime statusUpdatedAt;

    public int contentLength() {
        return contentDigest != null ? contentDigest.length() : 0;
    }

    public double qualityOrZero() {
        return qualityScore != null ? qualityScore : 0.0;
    }

    public void markDuplicate(CandidateStatus duplicateStatus, String reason) {
        this.status = duplicateStatus;
        this.exclusionReason = reason;
    }
}
