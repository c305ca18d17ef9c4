package com.newsdigest.backend.similarity;

import com.newsdigest.backend.config.DedupProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * TF-IDF over unigrams and bigrams, fitted on the texts being compared, scored by cosine.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class TfidfSimilarityStrategy implements SimilarityStrategy {

    private final DedupProperties dedupProperties;

    @Override
    public SimilarityMethod method() {
        return SimilarityMethod.TFIDF;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public double score(String textA, String textB) {
        return scoreAll(List.of(textA, textB))[0][1];
    }

    @Override
    public double[][] scoreAll(List<String> texts) {
        List<Map<String, Integer>> termCounts = texts.stream().map(this::termCounts).toList();
        Set<String> vocabulary = vocabulary(termCounts);

        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Map<String, Integer> counts : termCounts) {
            for (String term : counts.keySet()) {
                if (vocabulary.contains(term)) {
                    documentFrequency.merge(term, 1, Integer::sum);
                }
            }
        }

        int documents = texts.size();
        List<Map<String, Double>> vectors = new ArrayList<>(documents);
        for (Map<String, Integer> counts : termCounts) {
            Map<String, Double> vector = new HashMap<>();
            double norm = 0.0;
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                Integer df = documentFrequency.get(entry.getKey());
                if (df == null) {
                    continue;
                }
                // Smoothed idf, as the common vectorizers compute it
                double idf = Math.log((1.0 + documents) / (1.0 + df)) + 1.0;
                double weight = entry.getValue() * idf;
                vector.put(entry.getKey(), weight);
                norm += weight * weight;
            }
            double length = Math.sqrt(norm);
            if (length > 0) {
                vector.replaceAll((term, weight) -> weight / length);
            }
            vectors.add(vector);
        }

        double[][] matrix = new double[documents][documents];
        for (int i = 0; i < documents; i++) {
            matrix[i][i] = vectors.get(i).isEmpty() ? 0.0 : 1.0;
            for (int j = i + 1; j < documents; j++) {
                double value = SimilarityStrategy.clamp(dot(vectors.get(i), vectors.get(j)));
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }
        return matrix;
    }

    private Map<String, Integer> termCounts(String text) {
        Map<String, Integer> counts = new HashMap<>();
        LexicalAnalyzer.termsWithBigrams(text).forEach(term -> counts.merge(term, 1, Integer::sum));
        return counts;
    }

    // Most frequent terms across the corpus, ties broken alphabetically for determinism
    private Set<String> vocabulary(List<Map<String, Integer>> termCounts) {
        Map<String, Integer> corpusFrequency = new HashMap<>();
        termCounts.forEach(counts -> counts.forEach((term, count) -> corpusFrequency.merge(term, count, Integer::sum)));
        int maxFeatures = dedupProperties.getSimilarity().getTfidfMaxFeatures();
        if (corpusFrequency.size() <= maxFeatures) {
            return corpusFrequency.keySet();
        }
        Set<String> vocabulary = new HashSet<>();
        corpusFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.naturalOrder())))
                .limit(maxFeatures)
                .forEach(entry -> vocabulary.add(entry.getKey()));
        return vocabulary;
    }

    private static double dot(Map<String, Double> a, Map<String, Double> b) {
        Map<String, Double> smaller = a.size() <= b.size() ? a : b;
        Map<String, Double> larger = smaller == a ? b : a;
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : smaller.entrySet()) {
            Double other = larger.get(entry.getKey());
            if (other != null) {
                sum += entry.getValue() * other;
            }
        }
        return sum;
    }
}
