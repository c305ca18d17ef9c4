package com.newsdigest.backend.pipeline.repository;

import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.entity.StepCheckpoint;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface StepCheckpointRepository extends JpaRepository<StepCheckpoint, Long> {

    @Query("SELECT c.itemId FROM StepCheckpoint c WHERE c.runId = :runId AND c.step = :step")
    List<Long> findItemIds(@Param("runId") String runId, @Param("step") PipelineStep step);

    boolean existsByRunIdAndStepAndItemId(String runId, PipelineStep step, Long itemId);

    @Modifying
    @Query("DELETE FROM StepCheckpoint c WHERE c.runId IN :runIds")
    int deleteByRunIdIn(@Param("runIds") Collection<String> runIds);
}
