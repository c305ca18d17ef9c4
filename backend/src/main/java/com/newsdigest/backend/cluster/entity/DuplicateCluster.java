package com.newsdigest.backend.cluster.entity;

import com.newsdigest.backend.similarity.SimilarityMethod;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Items of one batch judged to cover the same story. Only item ids are held here; the
 * candidate table stays the single source of truth for the items themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "duplicate_clusters")
public class DuplicateCluster {
    @Id
    @Column(length = 64)
    private String clusterId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "duplicate_cluster_members", joinColumns = @JoinColumn(name = "cluster_id"))
    @Column(name = "item_id", nullable = false)
    @Builder.Default
    private Set<Long> memberIds = new LinkedHashSet<>();

    @Column(nullable = false)
    private Long primaryItemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SimilarityMethod clusteringMethod;

    @Column(nullable = false)
    private Double similarityThreshold;

    @Column(length = 500)
    private String selectionReason;

    @Column(length = 64)
    private String pipelineRunId;

    private LocalDate digestDay;

    @CreationTimestamp
    private LocalDateTime createdAt;

    public List<Long> sortedMemberIds() {
        List<Long> sorted = new ArrayList<>(memberIds);
        sorted.sort(null);
        return sorted;
    }

    public List<Long> secondaryItemIds() {
        return sortedMemberIds().stream().filter(id -> !id.equals(primaryItemId)).toList();
    }
}
