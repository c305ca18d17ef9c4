package com.newsdigest.backend.pipeline.entity;

import java.util.Arrays;
import java.util.List;

/**
 * Declared steps of a run, executed strictly in this order.
 */
public enum PipelineStep {
    COLLECTION(1, true),
    FILTERING(2, true),
    SCRAPING(3, true),
    SUMMARIZATION(4, true),
    DEDUP(5, true),
    ANALYSIS(6, true);

    private final int order;
    private final boolean resumable;

    PipelineStep(int order, boolean resumable) {
        this.order = order;
        this.resumable = resumable;
    }

    public int getOrder() {
        return order;
    }

    public boolean isResumable() {
        return resumable;
    }

    public static List<PipelineStep> ordered() {
        return Arrays.stream(values())
                .sorted((a, b) -> Integer.compare(a.order, b.order))
                .toList();
    }
}
