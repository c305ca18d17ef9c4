package com.newsdigest.backend.pipeline.dto;

import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepStatusDTO {
    private PipelineStep step;
    private int order;
    private ExecutionStatus status;
    private int processed;
    private int succeeded;
    private int failed;
    private String errorMessage;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationSeconds;
    private boolean canResume;
}
