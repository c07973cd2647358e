package me.golemcore.reasoning.domain.notebook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotebookPresetRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledPresets() {
        NotebookPresetRegistry registry = registry("classpath:notebook/presets.json");

        NotebookPreset preset = registry.get("tree_of_thought").orElseThrow();

        assertEquals("tree_of_thought", preset.getKey());
        assertFalse(preset.getCells().isEmpty());
        assertTrue(registry.list().size() >= 6);
        assertTrue(registry.get("ooda_loop").isPresent());
    }

    @Test
    void shouldLoadPresetsFromFile() throws IOException {
        Path file = tempDir.resolve("presets.json");
        Files.writeString(file, "{\"demo\":{\"name\":\"Demo\",\"cells\":["
                + "{\"kind\":\"markdown\",\"source\":\"# Demo\"},"
                + "{\"kind\":\"code\",\"source\":\"1\",\"language\":\"javascript\"}]}}");

        NotebookPresetRegistry registry = registry(file.toUri().toString());

        NotebookPreset preset = registry.get("demo").orElseThrow();
        assertEquals(CellKind.MARKDOWN, preset.getCells().get(0).getKind());
        assertEquals(CellKind.CODE, preset.getCells().get(1).getKind());
    }

    @Test
    void shouldStayEmptyWhenLocationIsMissing() {
        NotebookPresetRegistry registry = registry("classpath:notebook/missing.json");

        assertTrue(registry.list().isEmpty());
        assertTrue(registry.get("tree_of_thought").isEmpty());
    }

    @Test
    void shouldStayEmptyWhenFileIsMalformed() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        NotebookPresetRegistry registry = registry(file.toUri().toString());

        assertTrue(registry.list().isEmpty());
    }

    private static NotebookPresetRegistry registry(String location) {
        ReasoningProperties properties = new ReasoningProperties();
        properties.getNotebook().setPresetsLocation(location);
        NotebookPresetRegistry registry = new NotebookPresetRegistry(properties, new ObjectMapper());
        registry.init();
        return registry;
    }
}
