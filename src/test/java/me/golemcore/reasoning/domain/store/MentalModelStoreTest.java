package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.MentalModelApplication;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MentalModelStoreTest {

    @Test
    void shouldTrackModelUsageAndProblems() {
        MentalModelStore store = new MentalModelStore();
        assertTrue(store.getMostUsedModel().isEmpty());

        store.add("m1", model("first_principles", "Why is the build slow?"));
        store.add("m2", model("first_principles", "Should we rewrite the parser?"));
        store.add("m3", model("opportunity_cost", "Why is the build slow?"));

        assertEquals(2, store.getByModel("first_principles").size());
        assertEquals("first_principles", store.getMostUsedModel().orElseThrow());
        assertEquals(Set.of("Why is the build slow?", "Should we rewrite the parser?"), store.getUniqueProblems());
        assertEquals(3, store.getStatistics().total());
    }

    private static MentalModelApplication model(String name, String problem) {
        return MentalModelApplication.builder().modelName(name).problem(problem).build();
    }
}
