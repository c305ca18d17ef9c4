package com.newsdigest.backend.signature.repository;

import com.newsdigest.backend.signature.entity.TopicSignature;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TopicSignatureRepository extends JpaRepository<TopicSignature, Long> {

    List<TopicSignature> findByDigestDayOrderByRunSequenceAscIdAsc(LocalDate digestDay);

    Optional<TopicSignature> findByDigestDayAndSourceItemId(LocalDate digestDay, Long sourceItemId);

    Optional<TopicSignature> findBySignatureId(String signatureId);

    Optional<TopicSignature> findFirstByDigestDayAndPipelineRunId(LocalDate digestDay, String pipelineRunId);

    @Query("SELECT MAX(s.runSequence) FROM TopicSignature s WHERE s.digestDay = :day")
    Integer findMaxRunSequence(@Param("day") LocalDate day);

    long countByDigestDay(LocalDate digestDay);

    @Modifying
    @Query("DELETE FROM TopicSignature s WHERE s.digestDay < :cutoff")
    int deleteByDigestDayBefore(@Param("cutoff") LocalDate cutoff);
}
