package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.Argument;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ArgumentStoreTest {

    @Test
    void shouldIndexTypesClaimsAndResponses() {
        ArgumentStore store = new ArgumentStore();
        store.add("a1", Argument.builder().argumentId("a1").argumentType("thesis")
                .claim("Remote work improves productivity").confidence(0.8).build());
        store.add("a2", Argument.builder().argumentId("a2").argumentType("antithesis")
                .claim("Remote work hurts mentoring").respondsTo("a1").confidence(0.6).build());

        assertEquals(1, store.getByType("thesis").size());
        assertEquals(2, store.getByClaimKeyword("remote").size());
        assertEquals(1, store.getByClaimKeyword("mentoring").size());
        assertEquals("a2", store.getResponsesTo("a1").get(0).getArgumentId());

        ArgumentStore.Statistics stats = store.getStatistics();
        assertEquals(2, stats.totalArguments());
        assertEquals(1, stats.responses());
        assertEquals(0.7, stats.averageConfidence(), 1e-9);
    }
}
