package com.newsdigest.backend.similarity;

public enum SimilarityMethod {
    EMBEDDING,
    TFIDF,
    TOKEN_OVERLAP,
    // Every backend failed; scores are 0
    NONE
}
