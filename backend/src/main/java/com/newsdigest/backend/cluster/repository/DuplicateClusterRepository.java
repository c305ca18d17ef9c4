package com.newsdigest.backend.cluster.repository;

import com.newsdigest.backend.cluster.entity.DuplicateCluster;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DuplicateClusterRepository extends JpaRepository<DuplicateCluster, String> {

    List<DuplicateCluster> findByPipelineRunIdOrderByCreatedAtAsc(String pipelineRunId);

    List<DuplicateCluster> findByDigestDay(LocalDate digestDay);

    boolean existsByPipelineRunId(String pipelineRunId);
}
