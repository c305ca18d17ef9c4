package com.newsdigest.backend.similarity;

import com.newsdigest.backend.config.DedupProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Dense-embedding cosine similarity through whatever {@link EmbeddingModel} Spring AI provides.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class EmbeddingSimilarityStrategy implements SimilarityStrategy {

    private final ObjectProvider<EmbeddingModel> embeddingModelProvider;
    private final DedupProperties dedupProperties;

    @Override
    public SimilarityMethod method() {
        return SimilarityMethod.EMBEDDING;
    }

    @Override
    public boolean isAvailable() {
        return dedupProperties.getSimilarity().isEmbeddingsEnabled()
                && embeddingModelProvider.getIfAvailable() != null;
    }

    @Override
    public double score(String textA, String textB) {
        return scoreAll(List.of(textA, textB))[0][1];
    }

    @Override
    public double[][] scoreAll(List<String> texts) {
        EmbeddingModel embeddingModel = embeddingModelProvider.getIfAvailable();
        if (embeddingModel == null) {
            throw new IllegalStateException("No embedding model configured");
        }
        List<float[]> embeddings = embeddingModel.embed(texts);
        if (embeddings.size() != texts.size()) {
            throw new IllegalStateException("Embedding model returned " + embeddings.size()
                    + " vectors for " + texts.size() + " texts");
        }
        log.debug("Embedded {} texts for similarity scoring", texts.size());

        int n = texts.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double value = SimilarityStrategy.clamp(cosine(embeddings.get(i), embeddings.get(j)));
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }
        return matrix;
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalStateException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
