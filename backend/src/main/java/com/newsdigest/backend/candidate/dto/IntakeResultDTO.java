package com.newsdigest.backend.candidate.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntakeResultDTO {
    private List<Long> acceptedIds;
    private List<SkippedCandidate> skipped;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedCandidate {
        private int index;
        private String title;
        private String reason;
    }
}
