package com.newsdigest.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.newsdigest.backend.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

class DedupPropertiesTest {

    @Test
    void modesCarryTheirOwnThresholds() {
        DedupProperties properties = new DedupProperties();

        assertEquals(0.85, properties.settingsFor(PipelineMode.EXPRESS).getSimilarityThreshold());
        assertEquals(10, properties.settingsFor(PipelineMode.EXPRESS).getMaxCount());
        assertEquals(0.75, properties.settingsFor(PipelineMode.DEEP).getSimilarityThreshold());
    }

    @Test
    void rejectsOutOfRangeThreshold() {
        DedupProperties properties = new DedupProperties();
        properties.getModes().get(PipelineMode.STANDARD).setSimilarityThreshold(1.3);

        assertThrows(InvalidConfigurationException.class, () -> properties.settingsFor(PipelineMode.STANDARD));
    }

    @Test
    void rejectsNonPositiveMaxCount() {
        DedupProperties properties = new DedupProperties();
        properties.getModes().get(PipelineMode.DEEP).setMaxCount(0);

        assertThrows(InvalidConfigurationException.class, () -> properties.settingsFor(PipelineMode.DEEP));
    }

    @Test
    void modeNamesResolveCaseInsensitively() {
        assertEquals(PipelineMode.DEEP, PipelineMode.fromName(" deep "));
        assertEquals(PipelineMode.STANDARD, PipelineMode.fromName(null));
        assertThrows(InvalidConfigurationException.class, () -> PipelineMode.fromName("turbo"));
    }
}
