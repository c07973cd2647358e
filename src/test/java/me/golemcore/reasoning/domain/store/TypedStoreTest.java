package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.ThoughtData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypedStoreTest {

    private ThoughtStore store;

    @BeforeEach
    void setUp() {
        store = new ThoughtStore();
    }

    @Test
    void shouldKeepInsertionOrder() {
        store.add("b", thought(2, null));
        store.add("a", thought(1, null));

        assertEquals(List.of("b", "a"), store.keys());
        assertEquals(2, store.getAll().get(0).getThoughtNumber());
    }

    @Test
    void shouldReplaceItemAndReindexOnSameId() {
        store.add("t", thought(1, "alpha"));
        store.add("t", thought(1, "beta"));

        assertEquals(1, store.size());
        assertTrue(store.getBranch("alpha").isEmpty());
        assertEquals(1, store.getBranch("beta").size());
    }

    @Test
    void shouldRemoveFromIndicesOnDelete() {
        store.add("t", thought(1, "alpha"));

        assertTrue(store.delete("t"));
        assertFalse(store.delete("t"));
        assertTrue(store.getBranch("alpha").isEmpty());
        assertTrue(store.getBranchIds().isEmpty());
    }

    @Test
    void shouldUpdateExistingItemOnly() {
        store.add("t", thought(1, null));

        assertTrue(store.update("t", t -> thought(1, "gamma")));
        assertFalse(store.update("missing", t -> t));
        assertEquals(1, store.getBranch("gamma").size());
    }

    @Test
    void shouldReplaceContentOnImport() {
        store.add("old", thought(9, "stale"));
        Map<String, ThoughtData> imported = new LinkedHashMap<>();
        imported.put("x", thought(1, "fresh"));

        store.importData(imported);

        assertFalse(store.has("old"));
        assertTrue(store.getBranch("stale").isEmpty());
        assertEquals(1, store.getBranch("fresh").size());
        assertEquals(imported, store.exportData());
    }

    @Test
    void shouldAllowMutationInsideForEach() {
        store.add("a", thought(1, null));
        store.add("b", thought(2, null));

        store.forEach((id, t) -> store.delete(id));

        assertEquals(0, store.size());
    }

    @Test
    void shouldRejectNullIds() {
        ThoughtData thought = thought(1, null);
        assertThrows(NullPointerException.class, () -> store.add(null, thought));
    }

    @Test
    void shouldClearIndices() {
        store.add("a", thought(1, "alpha"));
        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.getBranchIds().isEmpty());
    }

    @Test
    void shouldConsultGuardForNewIdsOnly() {
        List<String> stored = new ArrayList<>();
        store.setGuard(new StoreGuard<ThoughtData>() {
            @Override
            public boolean admit(String id, ThoughtData item, int currentSize) {
                return currentSize < 1;
            }

            @Override
            public void stored(String id, ThoughtData item) {
                stored.add(id);
            }
        });

        assertTrue(store.add("a", thought(1, null)));
        assertFalse(store.add("b", thought(2, null)));
        assertTrue(store.add("a", thought(3, null)));
        assertTrue(store.update("a", t -> thought(4, null)));

        assertEquals(List.of("a"), store.keys());
        assertEquals(4, store.getAll().get(0).getThoughtNumber());
        assertEquals(List.of("a"), stored);
    }

    @Test
    void shouldRouteImportThroughGuard() {
        store.setGuard((id, item, currentSize) -> currentSize < 2);
        Map<String, ThoughtData> imported = new LinkedHashMap<>();
        imported.put("a", thought(1, null));
        imported.put("b", thought(2, null));
        imported.put("c", thought(3, null));

        store.importData(imported);

        assertEquals(List.of("a", "b"), store.keys());
    }

    private static ThoughtData thought(int number, String branchId) {
        return ThoughtData.builder()
                .thought("thought " + number)
                .thoughtNumber(number)
                .totalThoughts(5)
                .branchId(branchId)
                .build();
    }
}
