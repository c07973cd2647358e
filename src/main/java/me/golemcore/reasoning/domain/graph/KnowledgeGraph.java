/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.reasoning.domain.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.exception.CapacityExceededException;
import me.golemcore.reasoning.domain.exception.PersistenceException;
import me.golemcore.reasoning.domain.exception.ReferenceNotFoundException;
import me.golemcore.reasoning.domain.exception.ValidationException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory knowledge graph combining a depth hierarchy (parent and child
 * links, one level set per depth) with typed weighted edges.
 *
 * <p>
 * The deployment mode is fixed at construction. Its node, edge and depth
 * ceilings are checked on every mutation and nothing is ever evicted to make
 * room. The first node created becomes the hierarchy root.
 *
 * <p>
 * Clusters, centrality scores and knowledge gaps are computed elsewhere and
 * only stored here. All methods are synchronized and return copies.
 */
@Slf4j
public class KnowledgeGraph {

    static final double DEFAULT_WEIGHT = 0.5;
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final String DEFAULT_PASS = "initial";

    private final String graphId;
    private final DeploymentMode mode;
    private final Clock clock;

    private final Map<String, KnowledgeNode> nodes = new LinkedHashMap<>();
    private final Map<String, KnowledgeEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<String>> edgesBySource = new LinkedHashMap<>();
    private final TreeMap<Integer, Set<String>> levels = new TreeMap<>();
    private final Map<String, List<String>> parentChild = new LinkedHashMap<>();
    private final Map<String, Cluster> clusters = new LinkedHashMap<>();
    private List<KnowledgeGap> gaps = new ArrayList<>();
    private String rootId;
    private int maxDepth;
    private double avgDegree;

    public KnowledgeGraph(String graphId, DeploymentMode mode, Clock clock) {
        this.graphId = graphId;
        this.mode = mode;
        this.clock = clock;
    }

    public String getGraphId() {
        return graphId;
    }

    public DeploymentMode getMode() {
        return mode;
    }

    public DeploymentMode.ResourceLimits getResourceLimits() {
        return mode.getLimits();
    }

    /**
     * Creates a node and links it under its parent.
     *
     * @return the generated node id
     * @throws CapacityExceededException
     *             when the graph already holds the mode's node ceiling
     * @throws ValidationException
     *             when the depth is negative or deeper than the mode allows
     * @throws ReferenceNotFoundException
     *             when a parent id is given but absent
     */
    public synchronized String createNode(NodeDraft draft) {
        DeploymentMode.ResourceLimits limits = mode.getLimits();
        if (nodes.size() >= limits.maxNodes()) {
            throw new CapacityExceededException("nodes", limits.maxNodes(),
                    "Maximum node limit (" + limits.maxNodes() + ") reached for mode " + mode.getValue());
        }
        if (draft.getDepth() < 0) {
            throw new ValidationException("Node depth must not be negative: " + draft.getDepth());
        }
        if (draft.getDepth() > limits.maxDepth()) {
            throw new ValidationException("Maximum depth (" + limits.maxDepth() + ") exceeded: " + draft.getDepth());
        }
        if (draft.getParentId() != null && !nodes.containsKey(draft.getParentId())) {
            throw new ReferenceNotFoundException("Parent node", draft.getParentId());
        }

        String id = "node-" + UUID.randomUUID();
        KnowledgeNode node = KnowledgeNode.builder()
                .id(id)
                .content(draft.getContent() == null ? "" : draft.getContent())
                .type(draft.getType() == null ? NodeType.SUBJECT : draft.getType())
                .depth(draft.getDepth())
                .parentId(draft.getParentId())
                .confidence(draft.getConfidence() == null ? DEFAULT_CONFIDENCE : draft.getConfidence())
                .createdInPass(draft.getCreatedInPass() == null ? DEFAULT_PASS : draft.getCreatedInPass())
                .lastModified(clock.instant())
                .tags(draft.getTags() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(draft.getTags()))
                .patternUsed(draft.getPatternUsed())
                .artifacts(draft.getArtifacts() == null ? null : draft.getArtifacts().copy())
                .build();
        nodes.put(id, node);
        linkIntoHierarchy(node);
        if (nodes.size() == 1) {
            rootId = id;
        }
        maxDepth = Math.max(maxDepth, node.getDepth());
        log.debug("[Graph] {} created node {} at depth {}", graphId, id, node.getDepth());
        return id;
    }

    /**
     * Adds an edge between two existing nodes.
     *
     * @return the generated edge id
     */
    public synchronized String addEdge(EdgeDraft draft) {
        DeploymentMode.ResourceLimits limits = mode.getLimits();
        if (edges.size() >= limits.maxEdges()) {
            throw new CapacityExceededException("edges", limits.maxEdges(),
                    "Maximum edge limit (" + limits.maxEdges() + ") reached for mode " + mode.getValue());
        }
        if (isBlank(draft.getSourceId()) || isBlank(draft.getTargetId())) {
            throw new ValidationException("Source and target ids are required");
        }
        if (!nodes.containsKey(draft.getSourceId())) {
            throw new ReferenceNotFoundException("Source node", draft.getSourceId());
        }
        if (!nodes.containsKey(draft.getTargetId())) {
            throw new ReferenceNotFoundException("Target node", draft.getTargetId());
        }
        Double weight = draft.getWeight();
        if (weight != null && !isValidWeight(weight)) {
            throw new ValidationException("Edge weight must be between 0 and 1: " + weight);
        }

        String id = "edge-" + UUID.randomUUID();
        KnowledgeEdge edge = KnowledgeEdge.builder()
                .id(id)
                .sourceId(draft.getSourceId())
                .targetId(draft.getTargetId())
                .relation(draft.getRelation() == null ? RelationType.RELATES_TO : draft.getRelation())
                .weight(weight == null ? DEFAULT_WEIGHT : weight)
                .confidence(draft.getConfidence() == null ? DEFAULT_CONFIDENCE : draft.getConfidence())
                .createdInPass(draft.getCreatedInPass() == null ? DEFAULT_PASS : draft.getCreatedInPass())
                .justification(draft.getJustification())
                .bidirectional(draft.isBidirectional())
                .build();
        edges.put(id, edge);
        linkEdge(edge);
        recomputeAverageDegree();
        return id;
    }

    public synchronized void updateNode(String nodeId, NodeUpdate update) {
        KnowledgeNode node = nodes.get(nodeId);
        if (node == null) {
            throw new ReferenceNotFoundException("Node", nodeId);
        }
        if (update.getContent() != null) {
            node.setContent(update.getContent());
        }
        if (update.getType() != null) {
            node.setType(update.getType());
        }
        if (update.getConfidence() != null) {
            node.setConfidence(update.getConfidence());
        }
        if (update.getCentrality() != null) {
            node.setCentrality(update.getCentrality());
        }
        if (update.getPassScores() != null) {
            node.getPassScores().putAll(update.getPassScores());
        }
        if (update.getCreatedInPass() != null) {
            node.setCreatedInPass(update.getCreatedInPass());
        }
        if (update.getTags() != null) {
            node.setTags(new LinkedHashSet<>(update.getTags()));
        }
        if (update.getPatternUsed() != null) {
            node.setPatternUsed(update.getPatternUsed());
        }
        if (update.getSelected() != null) {
            node.setSelected(update.getSelected());
        }
        if (update.getArtifacts() != null) {
            node.setArtifacts(node.getArtifacts() == null
                    ? update.getArtifacts().copy()
                    : node.getArtifacts().merge(update.getArtifacts()));
        }
        node.setLastModified(clock.instant());
    }

    /**
     * Removes a node with every edge touching it. Children stay in the graph
     * without a parent; if the root goes, the shallowest remaining node becomes
     * the root.
     *
     * @return {@code false} if the node does not exist
     */
    public synchronized boolean removeNode(String nodeId) {
        KnowledgeNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        Set<String> touching = new LinkedHashSet<>(node.getIncomingEdges());
        touching.addAll(node.getOutgoingEdges());
        touching.forEach(this::unlinkEdge);

        if (node.getParentId() != null) {
            KnowledgeNode parent = nodes.get(node.getParentId());
            if (parent != null) {
                parent.getChildIds().remove(nodeId);
            }
            List<String> siblings = parentChild.get(node.getParentId());
            if (siblings != null) {
                siblings.remove(nodeId);
                if (siblings.isEmpty()) {
                    parentChild.remove(node.getParentId());
                }
            }
        }
        for (String childId : node.getChildIds()) {
            KnowledgeNode child = nodes.get(childId);
            if (child != null) {
                child.setParentId(null);
            }
        }
        parentChild.remove(nodeId);

        Set<String> level = levels.get(node.getDepth());
        if (level != null) {
            level.remove(nodeId);
            if (level.isEmpty()) {
                levels.remove(node.getDepth());
            }
        }
        nodes.remove(nodeId);

        if (nodeId.equals(rootId)) {
            rootId = pickRoot();
        }
        maxDepth = levels.isEmpty() ? 0 : levels.lastKey();
        recomputeAverageDegree();
        log.debug("[Graph] {} removed node {} and {} edges", graphId, nodeId, touching.size());
        return true;
    }

    /**
     * @return {@code false} if the edge does not exist
     */
    public synchronized boolean removeEdge(String edgeId) {
        boolean removed = unlinkEdge(edgeId);
        if (removed) {
            recomputeAverageDegree();
        }
        return removed;
    }

    public synchronized Optional<KnowledgeNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId)).map(KnowledgeNode::copy);
    }

    public synchronized Optional<KnowledgeEdge> getEdge(String edgeId) {
        return Optional.ofNullable(edges.get(edgeId)).map(KnowledgeEdge::copy);
    }

    public synchronized List<KnowledgeNode> getAllNodes() {
        return nodes.values().stream().map(KnowledgeNode::copy).toList();
    }

    public synchronized List<KnowledgeEdge> getAllEdges() {
        return edges.values().stream().map(KnowledgeEdge::copy).toList();
    }

    public synchronized List<KnowledgeEdge> getOutgoingEdges(String nodeId) {
        KnowledgeNode node = nodes.get(nodeId);
        return node == null ? List.of() : resolveEdges(node.getOutgoingEdges());
    }

    public synchronized List<KnowledgeEdge> getIncomingEdges(String nodeId) {
        KnowledgeNode node = nodes.get(nodeId);
        return node == null ? List.of() : resolveEdges(node.getIncomingEdges());
    }

    public synchronized List<KnowledgeEdge> getEdgesBySource(String nodeId) {
        return resolveEdges(edgesBySource.getOrDefault(nodeId, Set.of()));
    }

    public synchronized List<KnowledgeEdge> getEdgesByType(RelationType relation) {
        return edges.values().stream()
                .filter(e -> e.getRelation() == relation)
                .map(KnowledgeEdge::copy)
                .toList();
    }

    public synchronized boolean hasNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * True if an edge leads from {@code fromId} to {@code toId}, counting
     * bidirectional edges in both directions.
     */
    public synchronized boolean hasEdgeBetween(String fromId, String toId) {
        KnowledgeNode from = nodes.get(fromId);
        if (from == null) {
            return false;
        }
        for (String edgeId : from.getOutgoingEdges()) {
            KnowledgeEdge edge = edges.get(edgeId);
            if (edge == null) {
                continue;
            }
            if (edge.getTargetId().equals(toId)
                    || (edge.isBidirectional() && edge.getSourceId().equals(toId))) {
                return true;
            }
        }
        return false;
    }

    public synchronized boolean markSelected(String nodeId, boolean selected) {
        KnowledgeNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setSelected(selected);
        return true;
    }

    public synchronized List<KnowledgeNode> getSelectedNodes() {
        return nodes.values().stream()
                .filter(KnowledgeNode::isSelected)
                .map(KnowledgeNode::copy)
                .toList();
    }

    public synchronized void setClusters(Collection<Cluster> newClusters) {
        clusters.clear();
        for (Cluster cluster : newClusters) {
            clusters.put(cluster.getId(), cluster.copy());
        }
    }

    public synchronized List<Cluster> getClusters() {
        return clusters.values().stream().map(Cluster::copy).toList();
    }

    public synchronized Optional<Cluster> getCluster(String clusterId) {
        return Optional.ofNullable(clusters.get(clusterId)).map(Cluster::copy);
    }

    /**
     * Stores externally computed centrality scores. Unknown node ids are
     * ignored.
     */
    public synchronized void updateCentrality(Map<String, Double> centrality) {
        centrality.forEach((nodeId, score) -> {
            KnowledgeNode node = nodes.get(nodeId);
            if (node != null) {
                node.setCentrality(score);
            }
        });
    }

    public synchronized void setGaps(List<KnowledgeGap> newGaps) {
        gaps = newGaps.stream().map(KnowledgeGap::copy).collect(Collectors.toList());
    }

    public synchronized List<KnowledgeGap> getGaps() {
        return gaps.stream().map(KnowledgeGap::copy).toList();
    }

    public synchronized GraphMetrics getMetrics() {
        return GraphMetrics.builder()
                .nodeCount(nodes.size())
                .edgeCount(edges.size())
                .avgDegree(avgDegree)
                .maxDepth(maxDepth)
                .clusterCount(clusters.size())
                .gaps(new ArrayList<>(getGaps()))
                .build();
    }

    public synchronized int getNodeCount() {
        return nodes.size();
    }

    public synchronized int getEdgeCount() {
        return edges.size();
    }

    public synchronized List<KnowledgeNode> getNodesAtDepth(int depth) {
        Set<String> ids = levels.getOrDefault(depth, Set.of());
        return ids.stream().map(nodes::get).map(KnowledgeNode::copy).toList();
    }

    public synchronized List<KnowledgeNode> getChildren(String nodeId) {
        return parentChild.getOrDefault(nodeId, List.of()).stream()
                .map(nodes::get)
                .filter(Objects::nonNull)
                .map(KnowledgeNode::copy)
                .toList();
    }

    public synchronized Optional<String> getRootId() {
        return Optional.ofNullable(rootId);
    }

    public synchronized GraphSnapshot snapshot() {
        Map<Integer, List<String>> levelCopy = new LinkedHashMap<>();
        levels.forEach((depth, ids) -> levelCopy.put(depth, new ArrayList<>(ids)));
        return GraphSnapshot.builder()
                .graphId(graphId)
                .mode(mode)
                .rootId(rootId)
                .nodes(new ArrayList<>(getAllNodes()))
                .edges(new ArrayList<>(getAllEdges()))
                .levels(levelCopy)
                .clusters(new ArrayList<>(getClusters()))
                .metrics(getMetrics())
                .build();
    }

    public String serialize(ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize knowledge graph " + graphId, e);
        }
    }

    public static KnowledgeGraph deserialize(String json, ObjectMapper objectMapper, Clock clock) {
        GraphSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid knowledge graph snapshot", e);
        }
        return restore(snapshot, clock);
    }

    /**
     * Rebuilds a graph from a snapshot. Adjacency sets, the source index,
     * levels, parent and child links and metrics are derived from the node and
     * edge records; edges whose endpoints are missing are dropped.
     *
     * @throws CapacityExceededException
     *             if the snapshot holds more nodes or edges than the mode allows
     * @throws ValidationException
     *             if a node depth or an edge weight is outside the mode's bounds
     */
    public static KnowledgeGraph restore(GraphSnapshot snapshot, Clock clock) {
        DeploymentMode mode = snapshot.getMode() == null ? DeploymentMode.STANDARD : snapshot.getMode();
        KnowledgeGraph graph = new KnowledgeGraph(snapshot.getGraphId(), mode, clock);
        List<KnowledgeNode> nodeRecords = snapshot.getNodes() == null ? List.of() : snapshot.getNodes();
        List<KnowledgeEdge> edgeRecords = snapshot.getEdges() == null ? List.of() : snapshot.getEdges();
        DeploymentMode.ResourceLimits limits = mode.getLimits();
        if (nodeRecords.size() > limits.maxNodes() || edgeRecords.size() > limits.maxEdges()) {
            throw new CapacityExceededException("graph", limits.maxNodes(),
                    "Snapshot of " + snapshot.getGraphId() + " exceeds the ceilings of mode " + mode.getValue());
        }
        for (KnowledgeNode record : nodeRecords) {
            if (record.getDepth() < 0 || record.getDepth() > limits.maxDepth()) {
                throw new ValidationException("Snapshot node " + record.getId() + " has depth " + record.getDepth()
                        + " outside [0, " + limits.maxDepth() + "] of mode " + mode.getValue());
            }
        }
        for (KnowledgeEdge record : edgeRecords) {
            if (!isValidWeight(record.getWeight())) {
                throw new ValidationException("Snapshot edge " + record.getId() + " has weight "
                        + record.getWeight() + " outside [0, 1]");
            }
        }
        synchronized (graph) {
            for (KnowledgeNode record : nodeRecords) {
                KnowledgeNode node = record.toBuilder()
                        .childIds(new LinkedHashSet<>())
                        .incomingEdges(new LinkedHashSet<>())
                        .outgoingEdges(new LinkedHashSet<>())
                        .passScores(record.getPassScores() == null
                                ? new LinkedHashMap<>()
                                : new LinkedHashMap<>(record.getPassScores()))
                        .tags(record.getTags() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(record.getTags()))
                        .type(record.getType() == null ? NodeType.SUBJECT : record.getType())
                        .build();
                graph.nodes.put(node.getId(), node);
            }
            for (KnowledgeNode node : graph.nodes.values()) {
                if (node.getParentId() != null && !graph.nodes.containsKey(node.getParentId())) {
                    node.setParentId(null);
                }
                graph.linkIntoHierarchy(node);
                graph.maxDepth = Math.max(graph.maxDepth, node.getDepth());
            }
            for (KnowledgeEdge record : edgeRecords) {
                if (!graph.nodes.containsKey(record.getSourceId()) || !graph.nodes.containsKey(record.getTargetId())) {
                    log.warn("[Graph] {} dropped edge {} with a missing endpoint", snapshot.getGraphId(),
                            record.getId());
                    continue;
                }
                KnowledgeEdge edge = record.copy();
                if (edge.getRelation() == null) {
                    edge.setRelation(RelationType.RELATES_TO);
                }
                graph.edges.put(edge.getId(), edge);
                graph.linkEdge(edge);
            }
            graph.rootId = snapshot.getRootId() != null && graph.nodes.containsKey(snapshot.getRootId())
                    ? snapshot.getRootId()
                    : graph.pickRoot();
            if (snapshot.getClusters() != null) {
                graph.setClusters(snapshot.getClusters());
            }
            if (snapshot.getMetrics() != null && snapshot.getMetrics().getGaps() != null) {
                graph.setGaps(snapshot.getMetrics().getGaps());
            }
            graph.recomputeAverageDegree();
        }
        return graph;
    }

    private static boolean isValidWeight(double weight) {
        return weight >= 0 && weight <= 1;
    }

    private void linkIntoHierarchy(KnowledgeNode node) {
        if (node.getParentId() != null) {
            KnowledgeNode parent = nodes.get(node.getParentId());
            parent.getChildIds().add(node.getId());
            parentChild.computeIfAbsent(node.getParentId(), k -> new ArrayList<>()).add(node.getId());
        }
        levels.computeIfAbsent(node.getDepth(), k -> new LinkedHashSet<>()).add(node.getId());
    }

    private void linkEdge(KnowledgeEdge edge) {
        edgesBySource.computeIfAbsent(edge.getSourceId(), k -> new LinkedHashSet<>()).add(edge.getId());
        KnowledgeNode source = nodes.get(edge.getSourceId());
        KnowledgeNode target = nodes.get(edge.getTargetId());
        source.getOutgoingEdges().add(edge.getId());
        target.getIncomingEdges().add(edge.getId());
        if (edge.isBidirectional()) {
            target.getOutgoingEdges().add(edge.getId());
            source.getIncomingEdges().add(edge.getId());
        }
    }

    private boolean unlinkEdge(String edgeId) {
        KnowledgeEdge edge = edges.remove(edgeId);
        if (edge == null) {
            return false;
        }
        Set<String> bySource = edgesBySource.get(edge.getSourceId());
        if (bySource != null) {
            bySource.remove(edgeId);
            if (bySource.isEmpty()) {
                edgesBySource.remove(edge.getSourceId());
            }
        }
        for (String endpoint : List.of(edge.getSourceId(), edge.getTargetId())) {
            KnowledgeNode node = nodes.get(endpoint);
            if (node != null) {
                node.getIncomingEdges().remove(edgeId);
                node.getOutgoingEdges().remove(edgeId);
            }
        }
        return true;
    }

    private String pickRoot() {
        for (Set<String> level : levels.values()) {
            if (!level.isEmpty()) {
                return level.iterator().next();
            }
        }
        return null;
    }

    private void recomputeAverageDegree() {
        if (nodes.isEmpty()) {
            avgDegree = 0;
            return;
        }
        long total = 0;
        for (KnowledgeNode node : nodes.values()) {
            total += node.getIncomingEdges().size() + node.getOutgoingEdges().size();
        }
        avgDegree = (double) total / nodes.size();
    }

    private List<KnowledgeEdge> resolveEdges(Collection<String> edgeIds) {
        List<KnowledgeEdge> result = new ArrayList<>(edgeIds.size());
        for (String edgeId : edgeIds) {
            KnowledgeEdge edge = edges.get(edgeId);
            if (edge != null) {
                result.add(edge.copy());
            }
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
