package com.newsdigest.backend.pipeline.repository;

import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.entity.StepRecord;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface StepRecordRepository extends JpaRepository<StepRecord, Long> {

    List<StepRecord> findByRunIdOrderByStepOrderAsc(String runId);

    Optional<StepRecord> findByRunIdAndStep(String runId, PipelineStep step);

    @Modifying
    @Query("DELETE FROM StepRecord s WHERE s.runId IN :runIds")
    int deleteByRunIdIn(@Param("runIds") Collection<String> runIds);
}
