package com.newsdigest.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;

class ApplicationConfigurationTest {

    private Binder binder;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new FileSystemResource("src/main/resources/application.yml"));
        binder = new Binder(ConfigurationPropertySources.from(sources));
    }

    @Test
    @DisplayName("Model calls are attempted once so only the comparison retry policy retries")
    void modelClientDoesNotRetryOnItsOwn() {
        assertEquals(1, binder.bind("spring.ai.retry.max-attempts", Integer.class).get());
        assertFalse(binder.bind("spring.ai.retry.on-client-errors", Boolean.class).get());
        assertEquals(3, binder.bind("dedup.cross-run.retry-max-attempts", Integer.class).get());
    }
}
