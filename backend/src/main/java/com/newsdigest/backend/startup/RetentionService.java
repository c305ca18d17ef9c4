package com.newsdigest.backend.startup;

import com.newsdigest.backend.ai.service.ApiUsageMonitoringService;
import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.pipeline.service.RunStateMachine;
import com.newsdigest.backend.signature.service.DecisionLog;
import com.newsdigest.backend.signature.service.SignatureStore;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies both retention windows: signatures and decisions by day, finished runs and API usage
 * records by age.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    private final SignatureStore signatureStore;
    private final DecisionLog decisionLog;
    private final RunStateMachine stateMachine;
    private final ApiUsageMonitoringService apiUsageMonitoringService;
    private final DedupProperties dedupProperties;

    public Map<String, Object> cleanup() {
        DedupProperties.Retention retention = dedupProperties.getRetention();
        int signatures = signatureStore.cleanup(retention.getSignatureDays());
        int decisions = decisionLog.cleanup(retention.getSignatureDays());
        int runs = stateMachine.cleanup(retention.getRunDays());
        int apiUsage = apiUsageMonitoringService.cleanup(retention.getRunDays());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("signaturesDeleted", signatures);
        result.put("decisionsDeleted", decisions);
        result.put("runsDeleted", runs);
        result.put("apiUsageDeleted", apiUsage);
        result.put("timestamp", System.currentTimeMillis());
        log.info("🧹 Retention cleanup: {} signatures, {} decisions, {} runs, {} API usage records removed",
                signatures, decisions, runs, apiUsage);
        return result;
    }
}
