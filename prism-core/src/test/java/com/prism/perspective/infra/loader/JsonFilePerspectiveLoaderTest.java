package com.prism.perspective.infra.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.exceptions.PerspectiveLoadException;
import com.prism.perspective.api.model.PerspectiveDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFilePerspectiveLoaderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldMergeEntriesSharingAnId() throws IOException {
        Path file = write("""
                {"perspectives": [
                  {"id": 1, "name": "Equities", "is_active": true,
                   "rules": [{"apply_to": "both", "criteria": {"column": "a", "operator_type": "==", "value": 1}}]},
                  {"id": 2, "name": "Bonds", "is_supported": false, "rules": []},
                  {"id": 1, "name": "Ignored", "is_active": false,
                   "rules": [{"apply_to": "holding", "criteria": "{\\"column\\": \\"b\\", \\"operator_type\\": \\"IsNull\\"}"}]}
                ]}
                """);

        Map<Integer, PerspectiveDefinition> loaded = new JsonFilePerspectiveLoader(file, mapper).loadPerspectives(null);

        assertThat(loaded).containsOnlyKeys(1, 2);
        PerspectiveDefinition equities = loaded.get(1);
        assertThat(equities.name()).isEqualTo("Equities");
        assertThat(equities.rules()).hasSize(2);
        assertThat(equities.rules().get(1).applyTo()).isEqualTo("holding");
        assertThat(equities.rules().get(1).criteria().isTextual()).isTrue();
        assertThat(equities.active()).isFalse();
        assertThat(loaded.get(2).supported()).isFalse();
    }

    @Test
    void shouldFailOnMissingFile() {
        JsonFilePerspectiveLoader loader = new JsonFilePerspectiveLoader(tempDir.resolve("absent.json"), mapper);

        assertThatThrownBy(() -> loader.loadPerspectives(null))
                .isInstanceOf(PerspectiveLoadException.class)
                .hasMessageContaining("absent.json");
    }

    @Test
    void shouldFailWhenNoPerspectivesAreDefined() throws IOException {
        Path file = write("{\"perspectives\": []}");

        assertThatThrownBy(() -> new JsonFilePerspectiveLoader(file, mapper).loadPerspectives("2024-01-01T00:00:00"))
                .isInstanceOf(PerspectiveLoadException.class)
                .hasMessageContaining("No perspectives found");
    }

    @Test
    void shouldRejectEntryWithoutId() throws IOException {
        Path file = write("{\"perspectives\": [{\"name\": \"Nameless\", \"rules\": []}]}");

        assertThatThrownBy(() -> new JsonFilePerspectiveLoader(file, mapper).loadPerspectives(null))
                .isInstanceOf(PerspectiveLoadException.class)
                .hasMessageContaining("Nameless");
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("perspectives.json");
        Files.writeString(file, json);
        return file;
    }
}
