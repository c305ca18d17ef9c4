package com.newsdigest.backend.signature.service;

import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.exception.ComparisonResponseParseException;
import com.newsdigest.backend.exception.ComparisonServiceUnavailableException;
import com.newsdigest.backend.exception.StepInterruptedException;
import com.newsdigest.backend.exception.TransientExternalException;
import com.newsdigest.backend.pipeline.service.BatchControl;
import com.newsdigest.backend.signature.dto.DeduplicationOutcome;
import com.newsdigest.backend.signature.dto.TopicComparisonResult;
import com.newsdigest.backend.signature.entity.TopicSignature;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Suppresses stories already surfaced by an earlier run of the same day. Every failure on the
 * comparison side resolves to UNIQUE: a missed duplicate is cheaper than a dropped story.
 */
@Slf4j
@Service
public class CrossRunDeduplicator {

    private static final String SERVICE_UNAVAILABLE = "Comparison service unavailable, deduplication skipped";

    private final SignatureStore signatureStore;
    private final DedupLedger ledger;
    private final TopicComparisonService comparisonService;
    private final DedupProperties dedupProperties;
    private final Executor comparisonExecutor;

    public CrossRunDeduplicator(SignatureStore signatureStore,
                                DedupLedger ledger,
                                TopicComparisonService comparisonService,
                                DedupProperties dedupProperties,
                                @Qualifier("comparisonTaskExecutor") Executor comparisonExecutor) {
        this.signatureStore = signatureStore;
        this.ledger = ledger;
        this.comparisonService = comparisonService;
        this.dedupProperties = dedupProperties;
        this.comparisonExecutor = comparisonExecutor;
    }

    public DeduplicationOutcome deduplicate(LocalDate day, List<CandidateItem> candidates) {
        return deduplicate(day, candidates, null, BatchControl.NONE);
    }

    public DeduplicationOutcome deduplicate(LocalDate day, List<CandidateItem> candidates, String runId, BatchControl control) {
        List<CandidateItem> pending = candidates.stream()
                .filter(item -> !control.isCommitted(item.getId()))
                .toList();
        int skipped = candidates.size() - pending.size();
        if (skipped > 0) {
            log.info("⏭️ Skipping {} items already committed by run {}", skipped, runId);
        }

        int runSequence = signatureStore.resolveRunSequence(day, runId);
        // Signatures this run wrote before an interruption are not "earlier coverage"
        List<TopicSignature> prior = signatureStore.get(day).stream()
                .filter(s -> runId == null || !runId.equals(s.getPipelineRunId()))
                .toList();

        Map<Long, String> duplicates = new LinkedHashMap<>();
        List<Long> unique = new ArrayList<>();

        if (prior.isEmpty()) {
            log.info("🌅 First run of {}: {} candidates are unique (run sequence {})", day, pending.size(), runSequence);
            for (CandidateItem item : pending) {
                control.checkStop();
                ledger.recordUnique(item, day, runSequence, runId, null, 0L, null);
                unique.add(item.getId());
                control.committed(item.getId(), true);
            }
            return DeduplicationOutcome.builder()
                    .day(day)
                    .processed(pending.size())
                    .duplicates(duplicates)
                    .unique(unique)
                    .firstRun(true)
                    .runSequence(runSequence)
                    .skippedCommitted(skipped)
                    .build();
        }

        DedupProperties.CrossRun settings = dedupProperties.getCrossRun();
        List<TopicSignature> window = prior.subList(Math.max(0, prior.size() - settings.getComparisonWindow()), prior.size());
        log.info("🔍 Comparing {} candidates for {} against {} of {} prior signatures (run sequence {})",
                pending.size(), day, window.size(), prior.size(), runSequence);

        int errorCount = 0;
        int consecutiveFailures = 0;
        boolean degraded = false;
        int chunkSize = settings.getMaxConcurrentComparisons();
        long timeoutMs = settings.getComparisonTimeout().toMillis();

        for (int start = 0; start < pending.size(); start += chunkSize) {
            control.checkStop();
            List<CandidateItem> chunk = pending.subList(start, Math.min(start + chunkSize, pending.size()));

            if (degraded) {
                for (CandidateItem item : chunk) {
                    ledger.recordUnique(item, day, runSequence, runId, null, 0L, SERVICE_UNAVAILABLE);
                    unique.add(item.getId());
                    errorCount++;
                    control.committed(item.getId(), false);
                }
                continue;
            }

            // One deadline for the whole chunk: its comparisons run side by side
            long chunkStarted = System.currentTimeMillis();
            long deadline = chunkStarted + timeoutMs;
            List<CompletableFuture<TopicComparisonResult>> futures = chunk.stream()
                    .map(item -> CompletableFuture.supplyAsync(() -> comparisonService.compare(item, window), comparisonExecutor))
                    .toList();

            for (int i = 0; i < chunk.size(); i++) {
                CandidateItem item = chunk.get(i);
                TopicComparisonResult result = null;
                String error;
                try {
                    long remaining = Math.max(0L, deadline - System.currentTimeMillis());
                    result = futures.get(i).get(remaining, TimeUnit.MILLISECONDS);
                    error = null;
                } catch (TimeoutException e) {
                    futures.get(i).cancel(true);
                    error = "Comparison timed out after " + timeoutMs + " ms";
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StepInterruptedException(runId, "Interrupted while waiting for comparison of item " + item.getId());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof ComparisonServiceUnavailableException) {
                        degraded = true;
                    } else if (!(cause instanceof TransientExternalException) && !(cause instanceof ComparisonResponseParseException)) {
                        log.warn("⚠️ Unexpected comparison failure for item {}", item.getId(), cause);
                    }
                    error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                }
                long elapsed = System.currentTimeMillis() - chunkStarted;

                if (result != null && result.isDuplicate()) {
                    ledger.recordDuplicate(item, day, result.getMatchedSignatureId(), runId, result.getConfidence(), elapsed);
                    duplicates.put(item.getId(), result.getMatchedSignatureId());
                    consecutiveFailures = 0;
                    log.debug("Item {} repeats signature {}", item.getId(), result.getMatchedSignatureId());
                } else if (result != null) {
                    ledger.recordUnique(item, day, runSequence, runId, result.getConfidence(), elapsed, null);
                    unique.add(item.getId());
                    consecutiveFailures = 0;
                } else {
                    log.warn("⚠️ Comparison failed for item {}, keeping it as unique: {}", item.getId(), error);
                    ledger.recordUnique(item, day, runSequence, runId, null, elapsed, error);
                    unique.add(item.getId());
                    errorCount++;
                    consecutiveFailures++;
                }
                control.committed(item.getId(), error == null);
            }

            if (!degraded && consecutiveFailures >= settings.getUnavailableAfterFailures()) {
                degraded = true;
            }
            if (degraded && start + chunkSize < pending.size()) {
                log.warn("⚠️ Comparison service unavailable after {} consecutive failures, passing remaining {} items through",
                        consecutiveFailures, pending.size() - start - chunkSize);
            }
        }

        DeduplicationOutcome outcome = DeduplicationOutcome.builder()
                .day(day)
                .processed(pending.size())
                .duplicates(duplicates)
                .unique(unique)
                .degraded(degraded)
                .errorCount(errorCount)
                .runSequence(runSequence)
                .skippedCommitted(skipped)
                .build();
        log.info("✅ Cross-run dedup for {}: {} processed, {} duplicates, {} unique, {} errors{}",
                day, outcome.getProcessed(), duplicates.size(), unique.size(), errorCount, degraded ? " (degraded)" : "");
        return outcome;
    }
}
