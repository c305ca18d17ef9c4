package com.newsdigest.backend.signature.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Combined result of same-batch clustering and cross-run suppression.
 */
@Data
@AllArgsConstructor
public class DeduplicationReport {
    private int processed;
    private int batchDuplicates;
    private DeduplicationOutcome crossRun;

    public int duplicates() {
        return batchDuplicates + crossRun.getDuplicates().size();
    }

    public int unique() {
        return crossRun.getUnique().size();
    }

    public double rate() {
        return processed == 0 ? 0.0 : (double) duplicates() / processed;
    }

    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("processed", processed);
        summary.put("duplicates", duplicates());
        summary.put("unique", unique());
        summary.put("rate", Math.round(rate() * 1000) / 1000.0);
        summary.put("batchDuplicates", batchDuplicates);
        summary.put("crossRunDuplicates", crossRun.getDuplicates().size());
        summary.put("errors", crossRun.getErrorCount());
        summary.put("degraded", crossRun.isDegraded());
        return summary;
    }
}
