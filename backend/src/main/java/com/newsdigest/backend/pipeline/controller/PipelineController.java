package com.newsdigest.backend.pipeline.controller;

import com.newsdigest.backend.config.PipelineMode;
import com.newsdigest.backend.pipeline.dto.RunStatusDTO;
import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.service.PipelineOrchestrator;
import com.newsdigest.backend.pipeline.service.RunStateMachine;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/pipeline/runs")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineOrchestrator orchestrator;
    private final RunStateMachine stateMachine;
    private final Clock clock;

    /**
     * Start a run in the background; the day defaults to today
     */
    @PostMapping
    public ResponseEntity<RunStatusDTO> startRun(
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        PipelineMode pipelineMode = PipelineMode.fromName(mode);
        LocalDate digestDay = day != null ? day : LocalDate.now(clock);
        return ResponseEntity.accepted().body(orchestrator.startPipeline(pipelineMode, digestDay));
    }

    @GetMapping
    public ResponseEntity<List<RunStatusDTO>> recentRuns() {
        return ResponseEntity.ok(stateMachine.recentRuns());
    }

    @GetMapping("/incomplete")
    public ResponseEntity<List<RunStatusDTO>> incompleteRuns() {
        return ResponseEntity.ok(stateMachine.listIncomplete());
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunStatusDTO> getRunStatus(@PathVariable String runId) {
        return ResponseEntity.ok(stateMachine.getRunStatus(runId));
    }

    /**
     * Resume a paused (or crashed) run in the background
     */
    @PostMapping("/{runId}/resume")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String runId) {
        Optional<PipelineStep> next = orchestrator.resumeAsync(runId);
        Map<String, Object> body = new HashMap<>();
        body.put("runId", runId);
        body.put("resumedAt", next.map(Enum::name).orElse(null));
        body.put("message", next.isPresent() ? "Run resumed" : "Nothing left to run");
        body.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{runId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String runId) {
        boolean requested = orchestrator.requestStop(runId);
        return ResponseEntity.ok(Map.of(
                "runId", runId,
                "stopRequested", requested,
                "message", requested ? "Run will pause at the next item boundary" : "Run is not active",
                "timestamp", System.currentTimeMillis()
        ));
    }
}
