package com.newsdigest.backend.cluster.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering used to pick a cluster's primary: authority tier, quality score, recency and content
 * length, all descending, then original discovery position.
 */
final class PrimaryItemOrdering {

    private PrimaryItemOrdering() {
    }

    /**
     * Comparator over positions in {@code batch}; the smallest element under it is the primary.
     */
    static Comparator<Integer> over(List<CandidateItem> batch) {
        Comparator<Integer> byAuthority = Comparator.comparing(i -> batch.get(i).getAuthorityTier());
        Comparator<Integer> byQuality = Comparator.comparingDouble(i -> batch.get(i).qualityOrZero());
        Comparator<Integer> byRecency = Comparator.comparing(i -> batch.get(i).getDiscoveredAt());
        Comparator<Integer> byLength = Comparator.comparingInt(i -> batch.get(i).contentLength());
        return byAuthority.reversed()
                .thenComparing(byQuality.reversed())
                .thenComparing(byRecency.reversed())
                .thenComparing(byLength.reversed())
                .thenComparing(Comparator.naturalOrder());
    }
}
