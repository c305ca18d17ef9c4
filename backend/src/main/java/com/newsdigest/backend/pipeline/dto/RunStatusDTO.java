package com.newsdigest.backend.pipeline.dto;

import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Run progress as reported to the API: run lifecycle plus every step's counts and durations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStatusDTO {
    private String runId;
    private PipelineMode mode;
    private LocalDate day;
    private ExecutionStatus status;
    private PipelineStep currentStep;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationSeconds;
    private String errorMessage;
    private int completedSteps;
    private int totalSteps;
    private List<StepStatusDTO> steps;
}
