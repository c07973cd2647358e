package me.golemcore.reasoning.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArtifactKindTest {

    @Test
    void shouldResolveKindsByEveryName() {
        assertEquals(Optional.of(ArtifactKind.MENTAL_MODEL), ArtifactKind.fromWireName("mental_model"));
        assertEquals(Optional.of(ArtifactKind.MENTAL_MODEL), ArtifactKind.fromExportTag("mental-model"));
        assertEquals(Optional.of(ArtifactKind.MENTAL_MODEL), ArtifactKind.fromStoreName("mentalModels"));
        assertEquals(Optional.of(ArtifactKind.THOUGHT), ArtifactKind.fromExportTag("sequential"));
        assertEquals(Optional.empty(), ArtifactKind.fromWireName("sequential"));
    }

    @Test
    void shouldKeepNamesUnique() {
        assertEquals(ArtifactKind.values().length, distinct(ArtifactKind::getWireName).size());
        assertEquals(ArtifactKind.values().length, distinct(ArtifactKind::getExportTag).size());
        assertEquals(ArtifactKind.values().length, distinct(ArtifactKind::getStoreName).size());
        assertEquals(ArtifactKind.values().length, distinct(ArtifactKind::getToolName).size());
    }

    @Test
    void shouldClassifyArtifactInstances() {
        assertEquals(ArtifactKind.THOUGHT, ArtifactKind.of(ThoughtData.builder().thought("x").build()));
        assertThrows(IllegalArgumentException.class, () -> ArtifactKind.of(new ReasoningArtifact() {
        }));
    }

    private static Set<String> distinct(Function<ArtifactKind, String> name) {
        return Arrays.stream(ArtifactKind.values()).map(name).collect(Collectors.toSet());
    }
}
