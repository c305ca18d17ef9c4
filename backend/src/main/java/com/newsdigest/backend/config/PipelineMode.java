package com.newsdigest.backend.config;

import com.newsdigest.backend.exception.InvalidConfigurationException;

public enum PipelineMode {
    EXPRESS,
    STANDARD,
    DEEP;

    /**
     * Resolve a mode name case-insensitively, failing fast on unknown values.
     */
    public static PipelineMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return STANDARD;
        }
        for (PipelineMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("Unknown pipeline mode: " + name);
    }
}
