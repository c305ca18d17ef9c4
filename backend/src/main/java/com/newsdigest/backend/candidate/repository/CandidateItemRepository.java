package com.newsdigest.backend.candidate.repository;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.pipeline.entity.ExecutionStatus;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CandidateItemRepository extends JpaRepository<CandidateItem, Long> {

    // Discovery order is the id order
    List<CandidateItem> findByDigestDayAndStatusInOrderByIdAsc(LocalDate digestDay, Collection<CandidateStatus> statuses);

    // Candidates no run will come back for: never owned by a run, or owned by one that failed
    @Query("SELECT c FROM CandidateItem c WHERE c.digestDay = :day AND c.status = :status AND (c.pipelineRunId IS NULL"
            + " OR c.pipelineRunId IN (SELECT r.runId FROM PipelineRun r WHERE r.status = :failed)) ORDER BY c.id ASC")
    List<CandidateItem> findUnownedByDigestDayAndStatus(@Param("day") LocalDate day,
                                                        @Param("status") CandidateStatus status,
                                                        @Param("failed") ExecutionStatus failed);

    List<CandidateItem> findByPipelineRunIdAndStatusOrderBySelectionRankAsc(String pipelineRunId, CandidateStatus status);

    List<CandidateItem> findByPipelineRunIdAndStatusOrderByConfidenceDesc(String pipelineRunId, CandidateStatus status);

    List<CandidateItem> findByIdIn(Collection<Long> ids);

    boolean existsByFingerprintAndDigestDay(String fingerprint, LocalDate digestDay);

    // Funnel statistics per run
    @Query("SELECT c.status, COUNT(c) FROM CandidateItem c WHERE c.pipelineRunId = :runId GROUP BY c.status")
    List<Object[]> countByStatusForRun(@Param("runId") String runId);

    @Query("SELECT MIN(c.confidence) FROM CandidateItem c WHERE c.pipelineRunId = :runId AND c.selectionRank IS NOT NULL")
    Double findLowestSelectedConfidence(@Param("runId") String runId);
}
