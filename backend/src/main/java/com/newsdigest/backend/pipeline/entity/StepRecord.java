package com.newsdigest.backend.pipeline.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "pipeline_steps",
        uniqueConstraints = @UniqueConstraint(name = "uk_step_run_name", columnNames = {"run_id", "step_name"}))
public class StepRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 64)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_name", nullable = false, length = 32)
    private PipelineStep step;

    @Column(nullable = false)
    private Integer stepOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private Integer processedCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer succeededCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer failedCount = 0;

    // Most recent error, kept verbatim
    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    @Builder.Default
    private Boolean canResume = true;
}
