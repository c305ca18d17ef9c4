package com.newsdigest.backend.signature.controller;

import com.newsdigest.backend.signature.entity.DeduplicationDecision;
import com.newsdigest.backend.signature.entity.TopicSignature;
import com.newsdigest.backend.signature.service.DecisionLog;
import com.newsdigest.backend.signature.service.DeduplicationService;
import com.newsdigest.backend.signature.service.SignatureStore;
import com.newsdigest.backend.startup.RetentionService;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/dedup")
@RequiredArgsConstructor
public class DedupController {

    private final DeduplicationService deduplicationService;
    private final SignatureStore signatureStore;
    private final DecisionLog decisionLog;
    private final RetentionService retentionService;

    /**
     * Deduplicate the selected candidates of a day outside a pipeline run
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> triggerDedup(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        log.info("🚀 Manual dedup trigger for {}", day);
        return ResponseEntity.ok(deduplicationService.triggerDedup(day));
    }

    @GetMapping("/signatures")
    public ResponseEntity<List<TopicSignature>> signatures(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        return ResponseEntity.ok(signatureStore.get(day));
    }

    @GetMapping("/decisions")
    public ResponseEntity<List<DeduplicationDecision>> decisions(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day,
            @RequestParam(required = false) String runId) {
        if (runId != null) {
            return ResponseEntity.ok(decisionLog.forRun(runId));
        }
        if (day == null) {
            throw new IllegalArgumentException("Either day or runId is required");
        }
        return ResponseEntity.ok(decisionLog.forDay(day));
    }

    /**
     * Apply the retention windows now instead of waiting for the nightly job
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        return ResponseEntity.ok(retentionService.cleanup());
    }
}
