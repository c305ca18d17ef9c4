package com.newsdigest.backend.cluster.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.cluster.dto.ClusteringResult;
import com.newsdigest.backend.cluster.entity.DuplicateCluster;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.similarity.SimilarityEngine;
import com.newsdigest.backend.similarity.SimilarityMatrix;
import com.newsdigest.backend.similarity.SimilarityMethod;
import com.newsdigest.backend.similarity.TextNormalizer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Groups a batch into duplicate clusters with single-link clustering: an item joins a cluster
 * when it is similar enough to any one member, so members need not be mutually similar. This
 * favours catching every copy of a story over tight clusters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterBuilder {

    private static final int EXCERPT_LENGTH = 1000;

    private final SimilarityEngine similarityEngine;

    /**
     * Cluster ids are scoped to the run, or to the digest day when there is none, so a later run
     * clustering the same members never overwrites an earlier run's cluster.
     */
    public ClusteringResult build(List<CandidateItem> batch, double threshold, String runId) {
        DedupProperties.requireUnitInterval("similarityThreshold", threshold);
        if (batch.size() < 2) {
            List<Long> ids = batch.stream().map(CandidateItem::getId).toList();
            return new ClusteringResult(List.of(), ids, SimilarityMethod.NONE);
        }

        List<String> texts = batch.stream().map(ClusterBuilder::similarityText).toList();
        SimilarityMatrix matrix = similarityEngine.scoreAll(texts);

        int n = batch.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (matrix.score(i, j) >= threshold || sameFingerprint(batch.get(i), batch.get(j))) {
                    union(parent, i, j);
                }
            }
        }

        // Groups keyed by root, in order of each group's first member
        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(find(parent, i), root -> new ArrayList<>()).add(i);
        }

        Comparator<Integer> primaryOrdering = PrimaryItemOrdering.over(batch);
        List<DuplicateCluster> clusters = new ArrayList<>();
        List<Long> survivors = new ArrayList<>();
        for (List<Integer> members : groups.values()) {
            if (members.size() == 1) {
                continue;
            }
            int primary = members.stream().min(primaryOrdering).orElseThrow();
            CandidateItem primaryItem = batch.get(primary);
            LinkedHashSet<Long> memberIds = members.stream()
                    .map(i -> batch.get(i).getId())
                    .collect(Collectors.toCollection(LinkedHashSet::new));

            clusters.add(DuplicateCluster.builder()
                    .clusterId(clusterId(runId != null ? runId : "day:" + primaryItem.getDigestDay(), memberIds))
                    .memberIds(memberIds)
                    .primaryItemId(primaryItem.getId())
                    .clusteringMethod(matrix.getMethod())
                    .similarityThreshold(threshold)
                    .selectionReason(selectionReason(primaryItem, members.size()))
                    .digestDay(primaryItem.getDigestDay())
                    .build());
        }

        List<Long> primaries = clusters.stream().map(DuplicateCluster::getPrimaryItemId).toList();
        for (int i = 0; i < n; i++) {
            CandidateItem item = batch.get(i);
            boolean clustered = groups.get(find(parent, i)).size() > 1;
            if (!clustered || primaries.contains(item.getId())) {
                survivors.add(item.getId());
            }
        }

        log.info("🔗 Clustered {} items into {} duplicate clusters using {} (threshold {})",
                n, clusters.size(), matrix.getMethod(), threshold);
        return new ClusteringResult(clusters, survivors, matrix.getMethod());
    }

    static String similarityText(CandidateItem item) {
        String title = TextNormalizer.normalize(item.getTitle());
        String digest = item.getContentDigest();
        if (digest == null || digest.isBlank()) {
            return title;
        }
        return title + " " + (digest.length() > EXCERPT_LENGTH ? digest.substring(0, EXCERPT_LENGTH) : digest);
    }

    private static boolean sameFingerprint(CandidateItem a, CandidateItem b) {
        return a.getFingerprint() != null && Objects.equals(a.getFingerprint(), b.getFingerprint());
    }

    // Stable for one scope: rebuilding a run's clusters gives the same ids
    private static String clusterId(String scope, LinkedHashSet<Long> memberIds) {
        String key = scope + "|" + memberIds.stream().sorted().map(String::valueOf).collect(Collectors.joining(","));
        return "cl-" + DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, 16);
    }

    private static String selectionReason(CandidateItem primary, int clusterSize) {
        return String.format("Primary of %d: authority %d, quality %.2f, discovered %s, length %d",
                clusterSize, primary.getAuthorityTier(), primary.qualityOrZero(),
                primary.getDiscoveredAt(), primary.contentLength());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    // Lower index becomes the root so group order follows discovery order
    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) {
            return;
        }
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
    }
}
