package com.newsdigest.backend.signature.entity;

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
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Audit row for one cross-run judgment. Append-only: rows are never updated and only retention
 * cleanup deletes them.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Entity
@Table(name = "dedup_decisions", indexes = @Index(name = "idx_decisions_day", columnList = "digest_day"))
public class DeduplicationDecision {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long itemId;

    @Column(name = "digest_day", nullable = false, updatable = false)
    private LocalDate digestDay;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private DedupVerdict decision;

    @Column(length = 32, updatable = false)
    private String matchedSignatureId;

    @Column(updatable = false)
    private Double confidence;

    @Column(nullable = false, updatable = false)
    private Long processingTimeMs;

    // Set when the verdict is a fail-open fallback rather than a real judgment
    @Column(nullable = false, updatable = false)
    private boolean errorFlag;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    @Column(length = 64, updatable = false)
    private String pipelineRunId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
