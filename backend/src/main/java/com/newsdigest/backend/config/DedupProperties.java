package com.newsdigest.backend.config;

import com.newsdigest.backend.exception.InvalidConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "dedup")
public class DedupProperties {

    @Valid
    private Similarity similarity = new Similarity();

    @Valid
    private Selection selection = new Selection();

    @Valid
    private CrossRun crossRun = new CrossRun();

    @Valid
    private Retention retention = new Retention();

    // Per-mode overrides of threshold and batch size
    @Valid
    private Map<PipelineMode, ModeSettings> modes = defaultModes();

    @Data
    public static class Similarity {
        private boolean embeddingsEnabled = true;

        @Min(1)
        private int tfidfMaxFeatures = 1000;
    }

    @Data
    public static class Selection {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.70;

        @Min(1)
        private int maxCount = 30;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double nearMissMargin = 0.10;
    }

    @Data
    public static class CrossRun {
        @Min(1)
        private int comparisonWindow = 10;

        @Min(1)
        private int maxConcurrentComparisons = 4;

        @NotNull
        private Duration comparisonTimeout = Duration.ofSeconds(30);

        @Min(1)
        private int retryMaxAttempts = 3;

        @NotNull
        private Duration retryInitialBackoff = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double retryBackoffMultiplier = 2.0;

        // Consecutive failed comparisons after which the service is considered unreachable
        @Min(1)
        private int unavailableAfterFailures = 3;

        @Min(50)
        private int summaryExcerptLength = 500;
    }

    @Data
    public static class Retention {
        @Min(1)
        private int signatureDays = 7;

        @Min(1)
        private int runDays = 30;

        private String cleanupCron = "0 30 3 * * *";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModeSettings {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.75;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.70;

        @Min(1)
        private int maxCount = 30;
    }

    /**
     * Settings for a mode, validated again at run start so a bad value never reaches stored state.
     */
    public ModeSettings settingsFor(PipelineMode mode) {
        ModeSettings settings = modes.get(mode);
        if (settings == null) {
            settings = new ModeSettings(0.75, selection.getConfidenceThreshold(), selection.getMaxCount());
        }
        requireUnitInterval("similarityThreshold", settings.getSimilarityThreshold());
        requireUnitInterval("confidenceThreshold", settings.getConfidenceThreshold());
        if (settings.getMaxCount() < 1) {
            throw new InvalidConfigurationException("maxCount must be positive for mode " + mode);
        }
        return settings;
    }

    public static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(name + " must be within [0, 1] but was " + value);
        }
    }

    private static Map<PipelineMode, ModeSettings> defaultModes() {
        Map<PipelineMode, ModeSettings> defaults = new EnumMap<>(PipelineMode.class);
        defaults.put(PipelineMode.EXPRESS, new ModeSettings(0.85, 0.80, 10));
        defaults.put(PipelineMode.STANDARD, new ModeSettings(0.80, 0.70, 30));
        defaults.put(PipelineMode.DEEP, new ModeSettings(0.75, 0.60, 60));
        return defaults;
    }
}
