package com.newsdigest.backend.similarity;

import java.util.List;

/**
 * One similarity backend. Implementations may throw on any failure; the engine falls through
 * to the next weaker strategy.
 */
public interface SimilarityStrategy {

    SimilarityMethod method();

    boolean isAvailable();

    /**
     * Similarity of two already-normalized texts, in [0, 1].
     */
    double score(String textA, String textB);

    /**
     * Symmetric pairwise matrix over a batch. The default scores each pair independently.
     */
    default double[][] scoreAll(List<String> texts) {
        int n = texts.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double value = score(texts.get(i), texts.get(j));
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }
        return matrix;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
