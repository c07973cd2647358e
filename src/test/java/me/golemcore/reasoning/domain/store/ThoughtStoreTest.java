package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.ThoughtData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThoughtStoreTest {

    private ThoughtStore store;

    @BeforeEach
    void setUp() {
        store = new ThoughtStore();
        store.add("t3", ThoughtData.builder().thoughtNumber(3).totalThoughts(4).nextThoughtNeeded(true).build());
        store.add("t1", ThoughtData.builder().thoughtNumber(1).totalThoughts(4).nextThoughtNeeded(true).build());
        store.add("t2", ThoughtData.builder().thoughtNumber(2).totalThoughts(4).build());
        store.add("r1", ThoughtData.builder().thoughtNumber(4).totalThoughts(4)
                .isRevision(true).revisesThought(1).build());
        store.add("b1", ThoughtData.builder().thoughtNumber(2).totalThoughts(4)
                .branchFromThought(1).branchId("alt").build());
    }

    @Test
    void shouldOrderByThoughtNumber() {
        List<Integer> numbers = store.getOrdered().stream().map(ThoughtData::getThoughtNumber).toList();

        assertEquals(List.of(1, 2, 2, 3, 4), numbers);
    }

    @Test
    void shouldIndexBranchesAndRevisions() {
        assertEquals(Set.of("alt"), store.getBranchIds());
        assertEquals(1, store.getBranch("alt").size());
        assertEquals(1, store.getRevisions(1).size());
        assertTrue(store.getRevisions(2).isEmpty());
    }

    @Test
    void shouldReturnLatestAndRange() {
        assertEquals(4, store.getLatest().orElseThrow().getThoughtNumber());
        assertEquals(3, store.getRange(2, 3).size());
    }

    @Test
    void shouldListPendingThoughts() {
        assertEquals(2, store.getPending().size());
    }

    @Test
    void shouldComputeStatistics() {
        ThoughtStore.Statistics stats = store.getStatistics();

        assertEquals(5, stats.total());
        assertEquals(3, stats.regular());
        assertEquals(1, stats.revisions());
        assertEquals(1, stats.branched());
        assertEquals(1, stats.branches());
    }
}
