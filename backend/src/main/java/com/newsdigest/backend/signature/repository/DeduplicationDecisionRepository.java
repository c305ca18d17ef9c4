package com.newsdigest.backend.signature.repository;

import com.newsdigest.backend.signature.entity.DedupVerdict;
import com.newsdigest.backend.signature.entity.DeduplicationDecision;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DeduplicationDecisionRepository extends JpaRepository<DeduplicationDecision, Long> {

    List<DeduplicationDecision> findByDigestDayOrderByIdAsc(LocalDate digestDay);

    List<DeduplicationDecision> findByPipelineRunIdOrderByIdAsc(String pipelineRunId);

    long countByDigestDayAndDecision(LocalDate digestDay, DedupVerdict decision);

    long countByDigestDayAndErrorFlagTrue(LocalDate digestDay);

    @Modifying
    @Query("DELETE FROM DeduplicationDecision d WHERE d.digestDay < :cutoff")
    int deleteByDigestDayBefore(@Param("cutoff") LocalDate cutoff);
}
