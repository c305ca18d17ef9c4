package com.newsdigest.backend.pipeline.repository;

import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import com.newsdigest.backend.pipeline.entity.PipelineRun;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, String> {

    List<PipelineRun> findByStatusInOrderByCreatedAtDesc(Collection<ExecutionStatus> statuses);

    List<PipelineRun> findByStatusInAndCreatedAtBefore(Collection<ExecutionStatus> statuses, LocalDateTime cutoff);

    List<PipelineRun> findTop20ByOrderByCreatedAtDesc();

    boolean existsByDigestDayAndStatus(LocalDate digestDay, ExecutionStatus status);
}
