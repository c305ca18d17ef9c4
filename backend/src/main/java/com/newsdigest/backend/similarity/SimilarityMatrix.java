package com.newsdigest.backend.similarity;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Pairwise scores for a batch, all produced by the same backend.
 */
@Getter
@AllArgsConstructor
public class SimilarityMatrix {
    private final double[][] scores;
    private final SimilarityMethod method;

    public double score(int i, int j) {
        return scores[i][j];
    }

    public int size() {
        return scores.length;
    }
}
