package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.VisualOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VisualStoreTest {

    private VisualStore store;

    @BeforeEach
    void setUp() {
        store = new VisualStore();
    }

    @Test
    void shouldReplayDiagramOperations() {
        store.add("v1", op("arch", "create", element("a", "service"), element("b", "db")));
        store.add("v2", op("arch", "update", element("b", "cache"), element("c", "queue")));
        store.add("v3", op("arch", "transform", element("a", "gateway"), element("z", "ghost")));
        store.add("v4", op("arch", "observe", element("a", "ignored")));
        store.add("v5", op("arch", "delete", element("c", null)));

        List<VisualOperation.Element> state = store.getDiagramState("arch");

        assertEquals(List.of("a", "b"), state.stream().map(VisualOperation.Element::getId).toList());
        assertEquals("gateway", state.get(0).getLabel());
        assertEquals("cache", state.get(1).getLabel());
    }

    @Test
    void shouldListDiagramsByTypeOnce() {
        store.add("v1", op("arch", "create"));
        store.add("v2", op("arch", "add"));
        store.add("v3", op("flow", "create"));
        store.add("v4", VisualOperation.builder().diagramId("mind").diagramType("mindmap").operation("create")
                .build());

        assertEquals(List.of("arch", "flow"), store.getDiagramsByType("graph"));
        assertEquals(2, store.getByDiagram("arch").size());
        assertEquals(3, store.getByOperation("create").size());
    }

    @Test
    void shouldComputeStatistics() {
        store.add("v1", op("arch", "create"));
        store.add("v2", op("arch", "add"));

        VisualStore.Statistics stats = store.getStatistics();

        assertEquals(2, stats.totalOperations());
        assertEquals(1, stats.diagrams());
        assertEquals(1, stats.diagramTypes().get("graph"));
        assertEquals(1, stats.operations().get("add"));
    }

    private static VisualOperation op(String diagramId, String operation, VisualOperation.Element... elements) {
        return VisualOperation.builder()
                .diagramId(diagramId)
                .diagramType("graph")
                .operation(operation)
                .elements(List.of(elements))
                .build();
    }

    private static VisualOperation.Element element(String id, String label) {
        return VisualOperation.Element.builder().id(id).type("node").label(label).build();
    }
}
