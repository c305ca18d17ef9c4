package com.newsdigest.backend.signature.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * Typed outcome of one same-topic judgment. Only the parser creates these, so nothing
 * loosely typed from the comparison service reaches the deduplicator.
 */
@Getter
@ToString
public class TopicComparisonResult {

    public enum Verdict {
        UNIQUE,
        DUPLICATE
    }

    private final Verdict verdict;
    private final String matchedSignatureId;
    private final Double confidence;

    private TopicComparisonResult(Verdict verdict, String matchedSignatureId, Double confidence) {
        this.verdict = verdict;
        this.matchedSignatureId = matchedSignatureId;
        this.confidence = confidence;
    }

    public static TopicComparisonResult unique(Double confidence) {
        return new TopicComparisonResult(Verdict.UNIQUE, null, confidence);
    }

    public static TopicComparisonResult duplicate(String matchedSignatureId, Double confidence) {
        if (matchedSignatureId == null || matchedSignatureId.isBlank()) {
            throw new IllegalArgumentException("A duplicate verdict needs a matched signature id");
        }
        return new TopicComparisonResult(Verdict.DUPLICATE, matchedSignatureId, confidence);
    }

    public boolean isDuplicate() {
        return verdict == Verdict.DUPLICATE;
    }
}
