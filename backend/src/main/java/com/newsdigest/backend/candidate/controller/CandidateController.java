package com.newsdigest.backend.candidate.controller;

import com.newsdigest.backend.candidate.dto.CandidateItemDTO;
import com.newsdigest.backend.candidate.dto.IntakeResultDTO;
import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.candidate.entity.CandidateStatus;
import com.newsdigest.backend.candidate.service.CandidateService;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/candidates")
@RequiredArgsConstructor
public class CandidateController {

    private final CandidateService candidateService;

    /**
     * Accept collected candidates; malformed ones are reported back with their reason
     */
    @PostMapping
    public ResponseEntity<IntakeResultDTO> intake(@RequestBody List<CandidateItemDTO> candidates) {
        log.info("📥 Intake request with {} candidates", candidates.size());
        return ResponseEntity.ok(candidateService.intake(candidates));
    }

    /**
     * List a day's candidates, optionally filtered by status
     */
    @GetMapping
    public ResponseEntity<List<CandidateItem>> list(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day,
            @RequestParam(required = false) List<CandidateStatus> status) {
        List<CandidateStatus> statuses = status == null || status.isEmpty()
                ? Arrays.asList(CandidateStatus.values())
                : status;
        return ResponseEntity.ok(candidateService.forDay(day, statuses));
    }

    /**
     * Selection funnel and near misses of a run
     */
    @GetMapping("/selection/{runId}")
    public ResponseEntity<Map<String, Object>> selectionReport(@PathVariable String runId) {
        return ResponseEntity.ok(candidateService.selectionReport(runId));
    }
}
