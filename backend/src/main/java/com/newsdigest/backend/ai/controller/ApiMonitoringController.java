package com.newsdigest.backend.ai.controller;

import com.newsdigest.backend.ai.entity.ApiUsageLog;
import com.newsdigest.backend.ai.repository.ApiUsageLogRepository;
import com.newsdigest.backend.ai.service.ApiUsageMonitoringService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class ApiMonitoringController {

    private final ApiUsageMonitoringService monitoringService;
    private final ApiUsageLogRepository apiUsageLogRepository;

    /**
     * Get comparison-service usage statistics
     */
    @GetMapping("/api-usage")
    public ResponseEntity<Map<String, Object>> getApiUsage() {
        return ResponseEntity.ok(monitoringService.getUsageStats(ApiUsageMonitoringService.TOPIC_COMPARISON));
    }

    /**
     * Get every comparison call made for one item
     */
    @GetMapping("/api-usage/item/{itemId}")
    public ResponseEntity<List<ApiUsageLog>> getItemUsage(@PathVariable Long itemId) {
        return ResponseEntity.ok(apiUsageLogRepository.findByItemId(itemId));
    }
}
