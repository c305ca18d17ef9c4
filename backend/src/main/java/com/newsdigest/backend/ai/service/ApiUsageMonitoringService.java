package com.newsdigest.backend.ai.service;

import com.newsdigest.backend.ai.entity.ApiUsageLog;
import com.newsdigest.backend.ai.repository.ApiUsageLogRepository;
import com.newsdigest.backend.exception.StateStoreException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiUsageMonitoringService {

    public static final String TOPIC_COMPARISON = "TOPIC_COMPARISON";

    private final ApiUsageLogRepository apiUsageLogRepository;
    private final Clock clock;

    /**
     * Record one external call. Accounting must never break the call it accounts for, so a
     * failed write is only logged.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logApiUsage(String operation, Long itemId, int tokenCount, boolean success, String errorMessage) {
        try {
            apiUsageLogRepository.save(ApiUsageLog.builder()
                    .operation(operation)
                    .itemId(itemId)
                    .tokenCount(tokenCount)
                    .success(success)
                    .errorMessage(errorMessage)
                    .usedAt(LocalDateTime.now(clock))
                    .build());
        } catch (DataAccessException e) {
            log.warn("⚠️ Failed to log API usage for item {}: {}", itemId, e.getMessage());
        }
    }

    /**
     * Get comparison-service usage statistics
     */
    public Map<String, Object> getUsageStats(String operation) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime oneHourAgo = now.minusHours(1);
        LocalDateTime oneDayAgo = now.minusDays(1);

        Long hourlyCalls = apiUsageLogRepository.countOperationUsageSince(operation, oneHourAgo);
        Long dailyCalls = apiUsageLogRepository.countOperationUsageSince(operation, oneDayAgo);
        Long dailyFailures = apiUsageLogRepository.countOperationFailuresSince(operation, oneDayAgo);
        Long dailyTokens = apiUsageLogRepository.sumTokensByOperationSince(operation, oneDayAgo);

        List<ApiUsageLog> recentFailures = apiUsageLogRepository.findFailedOperations()
                .stream()
                .filter(usage -> usage.getUsedAt() != null && usage.getUsedAt().isAfter(oneDayAgo))
                .limit(10)
                .toList();

        long calls = dailyCalls != null ? dailyCalls : 0;
        long failures = dailyFailures != null ? dailyFailures : 0;
        return Map.of(
                "operation", operation,
                "hourlyCalls", hourlyCalls != null ? hourlyCalls : 0,
                "dailyCalls", calls,
                "dailyFailures", failures,
                "dailyTokens", dailyTokens != null ? dailyTokens : 0,
                "dailyFailureRate", calls > 0 ? Math.round((double) failures / calls * 1000) / 10.0 : 0.0,
                "recentFailures", recentFailures,
                "timestamp", now
        );
    }

    @Transactional
    public int cleanup(int retentionDays) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
        try {
            int deleted = apiUsageLogRepository.deleteByUsedAtBefore(cutoff);
            log.info("🧹 Cleaned up {} API usage records before {}", deleted, cutoff);
            return deleted;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to clean up API usage records before " + cutoff, e);
        }
    }

    /**
     * Rough token estimate, four characters per token
     */
    public static int estimateTokenCount(String text) {
        return text == null ? 0 : Math.max(1, text.length() / 4);
    }
}
