package com.newsdigest.backend.config;

import com.newsdigest.backend.exception.TransientExternalException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    private final DedupProperties dedupProperties;

    @Bean
    public Retry topicComparisonRetry() {
        return topicComparisonRetry(dedupProperties.getCrossRun());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Exponential backoff that only retries transient failures; parse errors and an unreachable
     * service are handed straight back to the caller.
     */
    public static Retry topicComparisonRetry(DedupProperties.CrossRun crossRun) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(crossRun.getRetryMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        crossRun.getRetryInitialBackoff(), crossRun.getRetryBackoffMultiplier()))
                .retryExceptions(TransientExternalException.class)
                .build();
        return Retry.of("topicComparison", config);
    }
}
