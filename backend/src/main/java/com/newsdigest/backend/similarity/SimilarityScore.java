package com.newsdigest.backend.similarity;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SimilarityScore {
    private double score;
    private SimilarityMethod method;
}
