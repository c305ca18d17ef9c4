package com.newsdigest.backend.signature.dto;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DeduplicationOutcome {
    private LocalDate day;
    private int processed;
    // Item id -> matched signature id
    @Builder.Default
    private Map<Long, String> duplicates = new LinkedHashMap<>();
    private List<Long> unique;
    private boolean firstRun;
    // Comparison service unreachable, remaining items passed through as unique
    private boolean degraded;
    private int errorCount;
    private int runSequence;
    // Items committed by an earlier attempt of the same run
    private int skippedCommitted;

    public double rate() {
        return processed == 0 ? 0.0 : (double) duplicates.size() / processed;
    }
}
