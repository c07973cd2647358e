package me.golemcore.reasoning.domain.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reasoning.domain.exception.CapacityExceededException;
import me.golemcore.reasoning.domain.exception.ReferenceNotFoundException;
import me.golemcore.reasoning.domain.exception.ValidationException;
import me.golemcore.reasoning.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeGraphTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = new KnowledgeGraph("g1", DeploymentMode.DEVELOPMENT, CLOCK);
    }

    @Test
    void shouldApplyDefaultsAndPickFirstNodeAsRoot() {
        String rootId = graph.createNode(NodeDraft.builder().content("root").build());
        String childId = graph.createNode(NodeDraft.builder().content("child").depth(1).parentId(rootId).build());

        KnowledgeNode root = graph.getNode(rootId).orElseThrow();
        assertEquals(NodeType.SUBJECT, root.getType());
        assertEquals(0.5, root.getConfidence());
        assertEquals("initial", root.getCreatedInPass());
        assertEquals(rootId, graph.getRootId().orElseThrow());
        assertEquals(List.of(childId), graph.getChildren(rootId).stream().map(KnowledgeNode::getId).toList());
        assertTrue(root.getChildIds().contains(childId));
        assertEquals(1, graph.getMetrics().getMaxDepth());
    }

    @Test
    void shouldRejectNodesBeyondDevelopmentCeiling() {
        for (int i = 0; i < 500; i++) {
            graph.createNode(NodeDraft.builder().content("n" + i).build());
        }

        CapacityExceededException e = assertThrows(CapacityExceededException.class,
                () -> graph.createNode(NodeDraft.builder().content("overflow").build()));
        assertEquals(500, e.getLimit());
        assertEquals(500, graph.getNodeCount());
    }

    @Test
    void shouldRejectDepthOutsideModeRange() {
        NodeDraft tooDeep = NodeDraft.builder().content("deep").depth(9).build();
        NodeDraft negative = NodeDraft.builder().content("neg").depth(-1).build();

        assertThrows(ValidationException.class, () -> graph.createNode(tooDeep));
        assertThrows(ValidationException.class, () -> graph.createNode(negative));
        assertEquals(0, graph.getNodeCount());
    }

    @Test
    void shouldRejectUnknownParent() {
        NodeDraft orphan = NodeDraft.builder().content("orphan").depth(1).parentId("node-missing").build();

        assertThrows(ReferenceNotFoundException.class, () -> graph.createNode(orphan));
    }

    @Test
    void shouldValidateEdges() {
        String a = graph.createNode(NodeDraft.builder().content("a").build());
        String b = graph.createNode(NodeDraft.builder().content("b").build());

        assertThrows(ValidationException.class,
                () -> graph.addEdge(EdgeDraft.builder().sourceId(a).targetId(b).weight(1.5).build()));
        assertThrows(ValidationException.class,
                () -> graph.addEdge(EdgeDraft.builder().sourceId(a).targetId(b).weight(Double.NaN).build()));
        assertThrows(ValidationException.class,
                () -> graph.addEdge(EdgeDraft.builder().sourceId(" ").targetId(b).build()));
        assertThrows(ReferenceNotFoundException.class,
                () -> graph.addEdge(EdgeDraft.builder().sourceId(a).targetId("node-missing").build()));
        assertEquals(0, graph.getEdgeCount());

        String edgeId = graph.addEdge(EdgeDraft.builder().sourceId(a).targetId(b).build());
        KnowledgeEdge edge = graph.getEdge(edgeId).orElseThrow();
        assertEquals(0.5, edge.getWeight());
        assertEquals(RelationType.RELATES_TO, edge.getRelation());
    }

    @Test
    void shouldRegisterBidirectionalEdgeOnBothEndpoints() {
        String a = graph.createNode(NodeDraft.builder().content("a").build());
        String b = graph.createNode(NodeDraft.builder().content("b").build());

        graph.addEdge(EdgeDraft.builder().sourceId(a).targetId(b).relation(RelationType.SUPPORTS)
                .bidirectional(true).build());

        assertTrue(graph.hasEdgeBetween(a, b));
        assertTrue(graph.hasEdgeBetween(b, a));
        assertEquals(1, graph.getOutgoingEdges(b).size());
        assertEquals(1, graph.getIncomingEdges(a).size());
        assertEquals(1, graph.getEdgesBySource(a).size());
        assertTrue(graph.getEdgesBySource(b).isEmpty());
        assertEquals(2.0, graph.getMetrics().getAvgDegree());
    }

    @Test
    void shouldTrackDirectedEdgeOneWay() {
        String a = graph.createNode(NodeDraft.builder().content("a").build());
        String b = graph.createNode(NodeDraft.builder().content("b").build());

        graph.addEdge(EdgeDraft.builder().sourceId(a).targetId(b).relation(RelationType.LEADS_TO).build());

        assertTrue(graph.hasEdgeBetween(a, b));
        assertFalse(graph.hasEdgeBetween(b, a));
        assertEquals(1, graph.getEdgesByType(RelationType.LEADS_TO).size());
        assertTrue(graph.getEdgesByType(RelationType.SUPPORTS).isEmpty());
    }

    @Test
    void shouldCascadeNodeRemoval() {
        String root = graph.createNode(NodeDraft.builder().content("root").build());
        String child = graph.createNode(NodeDraft.builder().content("child").depth(1).parentId(root).build());
        String grandchild = graph.createNode(
                NodeDraft.builder().content("grandchild").depth(2).parentId(child).build());
        String other = graph.createNode(NodeDraft.builder().content("other").depth(1).build());
        graph.addEdge(EdgeDraft.builder().sourceId(root).targetId(child).build());
        graph.addEdge(EdgeDraft.builder().sourceId(child).targetId(other).build());
        String kept = graph.addEdge(EdgeDraft.builder().sourceId(root).targetId(other).build());

        assertTrue(graph.removeNode(child));
        assertFalse(graph.removeNode(child));

        assertEquals(3, graph.getNodeCount());
        assertEquals(List.of(kept), graph.getAllEdges().stream().map(KnowledgeEdge::getId).toList());
        assertNull(graph.getNode(grandchild).orElseThrow().getParentId());
        assertTrue(graph.getChildren(root).isEmpty());
        assertEquals(1, graph.getNode(root).orElseThrow().getOutgoingEdges().size());
        assertEquals(1, graph.getNodesAtDepth(1).size());
    }

    @Test
    void shouldReassignRootToShallowestNode() {
        String root = graph.createNode(NodeDraft.builder().content("root").build());
        graph.createNode(NodeDraft.builder().content("deep").depth(2).build());
        String shallow = graph.createNode(NodeDraft.builder().content("shallow").depth(1).build());

        graph.removeNode(root);

        assertEquals(shallow, graph.getRootId().orElseThrow());
        assertEquals(2, graph.getMetrics().getMaxDepth());
    }

    @Test
    void shouldMergeNodeUpdates() {
        String id = graph.createNode(NodeDraft.builder().content("claim").tags(List.of("a")).build());

        graph.updateNode(id, NodeUpdate.builder().passScores(Map.of("first", 0.4)).build());
        graph.updateNode(id, NodeUpdate.builder()
                .confidence(0.9)
                .passScores(Map.of("second", 0.7))
                .tags(List.of("b"))
                .build());

        KnowledgeNode node = graph.getNode(id).orElseThrow();
        assertEquals("claim", node.getContent());
        assertEquals(0.9, node.getConfidence());
        assertEquals(Map.of("first", 0.4, "second", 0.7), node.getPassScores());
        assertEquals(List.of("b"), List.copyOf(node.getTags()));
        assertThrows(ReferenceNotFoundException.class,
                () -> graph.updateNode("node-missing", NodeUpdate.builder().build()));
    }

    @Test
    void shouldHandOutCopies() {
        String id = graph.createNode(NodeDraft.builder().content("original").build());

        graph.getNode(id).orElseThrow().setContent("mutated");

        assertEquals("original", graph.getNode(id).orElseThrow().getContent());
    }

    @Test
    void shouldTrackSelectionClustersCentralityAndGaps() {
        String a = graph.createNode(NodeDraft.builder().content("a").build());
        String b = graph.createNode(NodeDraft.builder().content("b").build());

        assertTrue(graph.markSelected(a, true));
        assertFalse(graph.markSelected("node-missing", true));
        graph.updateCentrality(Map.of(b, 0.8, "node-missing", 1.0));
        graph.setClusters(List.of(Cluster.builder().id("c1").nodeIds(List.of(a, b)).build()));
        graph.setGaps(List.of(KnowledgeGap.builder().type(GapType.MISSING_LINK).nodeIds(List.of(a, b))
                .priority(0.6).build()));

        assertEquals(1, graph.getSelectedNodes().size());
        assertEquals(0.8, graph.getNode(b).orElseThrow().getCentrality());
        assertEquals(2, graph.getCluster("c1").orElseThrow().getNodeIds().size());
        assertEquals(1, graph.getMetrics().getClusterCount());
        assertEquals(1, graph.getMetrics().getGaps().size());
    }

    @Test
    void shouldRoundTripThroughJson() {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        String root = graph.createNode(NodeDraft.builder().content("root").type(NodeType.QUESTION).build());
        String child = graph.createNode(NodeDraft.builder().content("child").depth(1).parentId(root).build());
        graph.addEdge(EdgeDraft.builder().sourceId(root).targetId(child).relation(RelationType.REFINES)
                .weight(0.9).bidirectional(true).build());

        KnowledgeGraph restored = KnowledgeGraph.deserialize(graph.serialize(mapper), mapper, CLOCK);

        assertEquals(DeploymentMode.DEVELOPMENT, restored.getMode());
        assertEquals(root, restored.getRootId().orElseThrow());
        assertEquals(NodeType.QUESTION, restored.getNode(root).orElseThrow().getType());
        assertEquals(List.of(child), restored.getChildren(root).stream().map(KnowledgeNode::getId).toList());
        assertTrue(restored.hasEdgeBetween(child, root));
        assertEquals(graph.getMetrics().getAvgDegree(), restored.getMetrics().getAvgDegree());
    }

    @Test
    void shouldDropEdgesWithMissingEndpointsOnRestore() {
        String a = graph.createNode(NodeDraft.builder().content("a").build());
        GraphSnapshot snapshot = graph.snapshot();
        snapshot.getEdges().add(KnowledgeEdge.builder().id("edge-dangling").sourceId(a).targetId("node-gone")
                .build());

        KnowledgeGraph restored = KnowledgeGraph.restore(snapshot, CLOCK);

        assertEquals(1, restored.getNodeCount());
        assertEquals(0, restored.getEdgeCount());
    }

    @Test
    void shouldRejectSnapshotNodeDeeperThanModeAllows() {
        graph.createNode(NodeDraft.builder().content("a").build());
        GraphSnapshot snapshot = graph.snapshot();
        snapshot.getNodes().get(0).setDepth(50);

        assertThrows(ValidationException.class, () -> KnowledgeGraph.restore(snapshot, CLOCK));

        snapshot.getNodes().get(0).setDepth(-1);
        assertThrows(ValidationException.class, () -> KnowledgeGraph.restore(snapshot, CLOCK));
    }

    @Test
    void shouldRejectSnapshotEdgeWeightOutsideUnitRange() {
        String a = graph.createNode(NodeDraft.builder().content("a").build());
        String b = graph.createNode(NodeDraft.builder().content("b").build());
        graph.addEdge(EdgeDraft.builder().sourceId(a).targetId(b).relation(RelationType.SUPPORTS).build());
        GraphSnapshot snapshot = graph.snapshot();
        snapshot.getEdges().get(0).setWeight(7.5);

        assertThrows(ValidationException.class, () -> KnowledgeGraph.restore(snapshot, CLOCK));

        snapshot.getEdges().get(0).setWeight(Double.NaN);
        assertThrows(ValidationException.class, () -> KnowledgeGraph.restore(snapshot, CLOCK));
    }

    @Test
    void shouldRejectMalformedSnapshot() {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertThrows(ValidationException.class, () -> KnowledgeGraph.deserialize("{nodes:", mapper, CLOCK));
    }
}
