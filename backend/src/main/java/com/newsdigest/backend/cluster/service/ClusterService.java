package com.newsdigest.backend.cluster.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.repository.CandidateItemRepository;
import com.newsdigest.backend.cluster.dto.ClusteringResult;
import com.newsdigest.backend.cluster.entity.DuplicateCluster;
import com.newsdigest.backend.cluster.repository.DuplicateClusterRepository;
import com.newsdigest.backend.exception.StateStoreException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Clusters a batch and persists the result: clusters are saved and every non-primary member
 * is excluded as a batch duplicate with a reason naming its primary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterService {

    private final ClusterBuilder clusterBuilder;
    private final DuplicateClusterRepository clusterRepository;
    private final CandidateItemRepository candidateRepository;

    @Transactional
    public ClusteringResult clusterAndPersist(List<CandidateItem> batch, double threshold, String runId) {
        ClusteringResult result = clusterBuilder.build(batch, threshold, runId);
        Map<Long, CandidateItem> byId = batch.stream()
                .collect(Collectors.toMap(CandidateItem::getId, Function.identity()));

        try {
            for (DuplicateCluster cluster : result.getClusters()) {
                cluster.setPipelineRunId(runId);
                clusterRepository.save(cluster);

                for (Long memberId : cluster.sortedMemberIds()) {
                    CandidateItem member = byId.get(memberId);
                    member.setClusterId(cluster.getClusterId());
                    if (!memberId.equals(cluster.getPrimaryItemId())) {
                        member.markDuplicate(CandidateStatus.BATCH_DUPLICATE,
                                "Same story as item " + cluster.getPrimaryItemId() + " in cluster " + cluster.getClusterId());
                        log.debug("Item {} excluded as batch duplicate of {}", memberId, cluster.getPrimaryItemId());
                    }
                    candidateRepository.save(member);
                }
            }
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to persist duplicate clusters", e);
        }
        return result;
    }

    public boolean hasClusters(String runId) {
        return runId != null && clusterRepository.existsByPipelineRunId(runId);
    }

    public List<DuplicateCluster> clustersForRun(String runId) {
        return clusterRepository.findByPipelineRunIdOrderByCreatedAtAsc(runId);
    }
}
