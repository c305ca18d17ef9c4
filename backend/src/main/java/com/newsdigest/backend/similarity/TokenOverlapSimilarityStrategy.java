package com.newsdigest.backend.similarity;

import java.util.HashSet;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Jaccard overlap of the analyzed term sets. Always available; the last resort.
 */
@Component
@Order(3)
public class TokenOverlapSimilarityStrategy implements SimilarityStrategy {

    @Override
    public SimilarityMethod method() {
        return SimilarityMethod.TOKEN_OVERLAP;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public double score(String textA, String textB) {
        Set<String> wordsA = LexicalAnalyzer.termSet(textA);
        Set<String> wordsB = LexicalAnalyzer.termSet(textB);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }
}
