package com.newsdigest.backend.cluster.dto;

import com.newsdigest.backend.cluster.entity.DuplicateCluster;
import com.newsdigest.backend.similarity.SimilarityMethod;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ClusteringResult {
    private List<DuplicateCluster> clusters;
    // Items that are not in any cluster plus every cluster primary, in input order
    private List<Long> survivingItemIds;
    private SimilarityMethod method;

    public int duplicateCount() {
        return clusters.stream().mapToInt(c -> c.getMemberIds().size() - 1).sum();
    }
}
