package com.prism.perspective.infra.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(EngineSettings.PERSPECTIVES_FILE);
        System.clearProperty(EngineSettings.REFERENCE_MAX_THREADS);
        System.clearProperty(EngineSettings.NESTED_CRITERIA_STRICT);
        System.clearProperty(EngineSettings.DEFAULT_EFFECTIVE_DATE);
    }

    @Test
    void shouldProvideDefaults() {
        EngineSettings settings = EngineSettings.defaults();

        assertThat(settings.perspectivesFile()).isEmpty();
        assertThat(settings.referenceMaxThreads()).isEqualTo(8);
        assertThat(settings.strictNestedCriteria()).isFalse();
        assertThat(settings.defaultEffectiveDate()).isEqualTo("2024-01-01");
    }

    @Test
    void shouldReadSystemProperties() {
        System.setProperty(EngineSettings.PERSPECTIVES_FILE, "/etc/prism/perspectives.json");
        System.setProperty(EngineSettings.REFERENCE_MAX_THREADS, "3");
        System.setProperty(EngineSettings.NESTED_CRITERIA_STRICT, "true");
        System.setProperty(EngineSettings.DEFAULT_EFFECTIVE_DATE, "2025-03-31");

        EngineSettings settings = EngineSettings.fromEnvironment();

        assertThat(settings.perspectivesFile()).contains(Path.of("/etc/prism/perspectives.json"));
        assertThat(settings.referenceMaxThreads()).isEqualTo(3);
        assertThat(settings.strictNestedCriteria()).isTrue();
        assertThat(settings.defaultEffectiveDate()).isEqualTo("2025-03-31");
    }

    @Test
    void shouldFallBackToDefaultThreadsOnInvalidValue() {
        System.setProperty(EngineSettings.REFERENCE_MAX_THREADS, "many");
        assertThat(EngineSettings.fromEnvironment().referenceMaxThreads()).isEqualTo(8);

        System.setProperty(EngineSettings.REFERENCE_MAX_THREADS, "0");
        assertThat(EngineSettings.fromEnvironment().referenceMaxThreads()).isEqualTo(8);
    }

    @Test
    void shouldRejectNonPositiveThreadsInCopies() {
        assertThatThrownBy(() -> EngineSettings.defaults().withReferenceMaxThreads(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(EngineSettings.defaults().withStrictNestedCriteria(true).strictNestedCriteria()).isTrue();
    }
}
