package com.newsdigest.backend.signature.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Fingerprint of a story already surfaced on a given day. Only ever compared within its day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "topic_signatures",
        uniqueConstraints = @UniqueConstraint(name = "uk_signature_day_item", columnNames = {"digest_day", "source_item_id"}),
        indexes = @Index(name = "idx_signatures_day", columnList = "digest_day, run_sequence"))
public class TopicSignature {
    // Surrogate key; also the insertion order within a run sequence
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 32)
    private String signatureId;

    @Column(name = "digest_day", nullable = false)
    private LocalDate digestDay;

    @Column(name = "run_sequence", nullable = false)
    private Integer runSequence;

    @Column(length = 200)
    private String themeLabel;

    @Column(columnDefinition = "TEXT")
    private String summaryExcerpt;

    @Column(name = "source_item_id", nullable = false)
    private Long sourceItemId;

    @Column(length = 64)
    private String pipelineRunId;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
