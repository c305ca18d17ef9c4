package com.newsdigest.backend.similarity;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores textual similarity with the strongest backend that works, falling through the ordered
 * strategies on failure. Callers never see a backend error: when every strategy fails the
 * score is 0 and the method is {@link SimilarityMethod#NONE}.
 */
@Slf4j
@Service
public class SimilarityEngine {

    static final double NORMALIZED_MATCH_SCORE = 0.95;

    private final List<SimilarityStrategy> strategies;

    public SimilarityEngine(List<SimilarityStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
        log.info("🧮 Similarity strategies in order: {}", this.strategies.stream().map(SimilarityStrategy::method).toList());
    }

    public SimilarityScore score(String textA, String textB) {
        SimilarityMatrix matrix = scoreAll(List.of(nullToEmpty(textA), nullToEmpty(textB)));
        return new SimilarityScore(matrix.score(0, 1), matrix.getMethod());
    }

    /**
     * Batched form: one backend call sequence for the whole batch, so every pair is scored by
     * the same method.
     */
    public SimilarityMatrix scoreAll(List<String> texts) {
        List<String> normalized = texts.stream().map(TextNormalizer::normalizeBody).toList();
        int n = texts.size();

        double[][] scores = null;
        SimilarityMethod method = SimilarityMethod.NONE;
        for (SimilarityStrategy strategy : strategies) {
            if (!strategy.isAvailable()) {
                continue;
            }
            try {
                scores = strategy.scoreAll(normalized);
                method = strategy.method();
                break;
            } catch (RuntimeException e) {
                log.warn("⚠️ {} similarity failed for batch of {}, falling back: {}",
                        strategy.method(), n, e.getMessage());
            }
        }
        if (scores == null) {
            log.warn("⚠️ All similarity strategies failed for batch of {}, treating every pair as not similar", n);
            scores = new double[n][n];
        }

        applyTextMatches(texts, normalized, scores);
        return new SimilarityMatrix(scores, method);
    }

    // Identical texts are duplicates whatever the backend says
    private static void applyTextMatches(List<String> raw, List<String> normalized, double[][] scores) {
        int n = raw.size();
        for (int i = 0; i < n; i++) {
            if (!normalized.get(i).isEmpty()) {
                scores[i][i] = 1.0;
            }
            for (int j = i + 1; j < n; j++) {
                if (normalized.get(i).isEmpty() || normalized.get(j).isEmpty()) {
                    scores[i][j] = 0.0;
                    scores[j][i] = 0.0;
                    continue;
                }
                double floor = 0.0;
                if (raw.get(i).trim().equals(raw.get(j).trim())) {
                    floor = 1.0;
                } else if (normalized.get(i).equals(normalized.get(j))) {
                    floor = NORMALIZED_MATCH_SCORE;
                }
                if (scores[i][j] < floor) {
                    scores[i][j] = floor;
                    scores[j][i] = floor;
                }
            }
        }
    }

    private static String nullToEmpty(String text) {
        return text != null ? text : "";
    }
}
