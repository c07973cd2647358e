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

package me.golemcore.reasoning.domain.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.ArtifactKind;
import me.golemcore.reasoning.domain.model.ReasoningArtifact;
import me.golemcore.reasoning.domain.model.TaggedArtifact;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import me.golemcore.reasoning.port.outbound.SchedulerPort;
import me.golemcore.reasoning.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide append log of tagged artifacts with an auxiliary graph
 * projection.
 *
 * <p>
 * Every added artifact becomes a graph node labelled with its kind. An artifact
 * carrying a correlation key (collaboration, decision, monitoring, inquiry or
 * diagram id) is also linked from a {@code session:<key>} concept node by a
 * {@value #HAS_ITEM} relation.
 *
 * <p>
 * When {@code reasoning.persistence.enabled} is set, every mutation re-arms a
 * debounce task. When it fires the log and the graph are written to two files
 * in the persistence directory. Both files are reloaded on startup; an
 * unreadable file means starting empty. Persistence failures are logged and
 * never reach the caller: the in-memory state stays authoritative.
 */
@Component
@Slf4j
public class UnifiedArtifactStore {

    public static final String HAS_ITEM = "HAS_ITEM";
    static final String SESSION_NODE_PREFIX = "session:";
    static final String SESSION_LABEL = "session";
    static final String CONCEPT_TYPE = "concept";

    private final ReasoningProperties.PersistenceProperties persistence;
    private final StoragePort storagePort;
    private final SchedulerPort scheduler;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, TaggedArtifact> entries = new LinkedHashMap<>();
    private final Map<String, AuxiliaryGraph.Node> nodes = new LinkedHashMap<>();
    private final Map<String, AuxiliaryGraph.Edge> edges = new LinkedHashMap<>();
    private SchedulerPort.ScheduledTask pendingSave;

    public UnifiedArtifactStore(ReasoningProperties properties, StoragePort storagePort, SchedulerPort scheduler,
            ObjectMapper objectMapper, Clock clock) {
        this.persistence = properties.getPersistence();
        this.storagePort = storagePort;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean isPersistenceEnabled() {
        return persistence.isEnabled();
    }

    @PostConstruct
    public void init() {
        if (!persistence.isEnabled()) {
            return;
        }
        try {
            storagePort.ensureDirectory(persistence.getDirectory()).join();
        } catch (RuntimeException e) {
            log.warn("[UnifiedStore] Failed to create persistence directory {}: {}", persistence.getDirectory(),
                    e.getMessage());
        }
        loadEntries();
        loadGraph();
        log.info("[UnifiedStore] Loaded {} artifacts and {} graph nodes from {}", entries.size(), nodes.size(),
                persistence.getDirectory());
    }

    /**
     * Appends an artifact under {@code id} (replacing any entry with that id)
     * and projects it into the auxiliary graph.
     */
    public void add(String id, TaggedArtifact artifact) {
        synchronized (this) {
            entries.put(id, artifact);
            project(id, artifact);
        }
        scheduleSave();
    }

    public synchronized List<TaggedArtifact> getByType(ArtifactKind kind) {
        return entries.values().stream().filter(e -> e.type() == kind).toList();
    }

    public synchronized List<TaggedArtifact> getAll() {
        return new ArrayList<>(entries.values());
    }

    public synchronized Optional<TaggedArtifact> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public synchronized int size() {
        return entries.size();
    }

    public void clear() {
        synchronized (this) {
            entries.clear();
            nodes.clear();
            edges.clear();
        }
        scheduleSave();
    }

    /**
     * Artifact count per kind wire name, for kinds with at least one artifact.
     */
    public synchronized Map<String, Integer> getStats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (TaggedArtifact entry : entries.values()) {
            stats.merge(entry.type().getWireName(), 1, Integer::sum);
        }
        return stats;
    }

    public synchronized Map<String, List<ReasoningArtifact>> exportByType() {
        Map<String, List<ReasoningArtifact>> result = new LinkedHashMap<>();
        for (TaggedArtifact entry : entries.values()) {
            result.computeIfAbsent(entry.type().getWireName(), k -> new ArrayList<>()).add(entry.data());
        }
        return result;
    }

    /**
     * Replaces the log with the given records grouped by kind wire name. Ids
     * are regenerated as {@code <wire>_<epochMillis>_<index>}, so an export and
     * re-import does not preserve ids. Unknown kinds and unreadable records are
     * skipped.
     *
     * @return the number of records imported
     */
    public int importByType(Map<String, ? extends List<?>> data) {
        int imported = 0;
        synchronized (this) {
            entries.clear();
            nodes.clear();
            edges.clear();
            long millis = clock.millis();
            for (Map.Entry<String, ? extends List<?>> group : data.entrySet()) {
                Optional<ArtifactKind> kind = ArtifactKind.fromWireName(group.getKey());
                if (kind.isEmpty()) {
                    log.warn("[UnifiedStore] Skipping import of unknown type '{}'", group.getKey());
                    continue;
                }
                List<?> items = group.getValue();
                for (int index = 0; index < items.size(); index++) {
                    Object item = items.get(index);
                    try {
                        ReasoningArtifact artifact = kind.get().getArtifactClass().isInstance(item)
                                ? (ReasoningArtifact) item
                                : objectMapper.convertValue(item, kind.get().getArtifactClass());
                        String id = kind.get().getWireName() + "_" + millis + "_" + index;
                        TaggedArtifact tagged = new TaggedArtifact(kind.get(), artifact);
                        entries.put(id, tagged);
                        project(id, tagged);
                        imported++;
                    } catch (IllegalArgumentException e) {
                        log.warn("[UnifiedStore] Skipping unreadable {} record {}: {}", group.getKey(), index,
                                e.getMessage());
                    }
                }
            }
        }
        scheduleSave();
        return imported;
    }

    /**
     * Adds a label to an existing graph node.
     *
     * @return {@code false} if the node does not exist
     */
    public boolean tagNode(String nodeId, String label) {
        synchronized (this) {
            if (!addLabel(nodeId, label)) {
                return false;
            }
        }
        scheduleSave();
        return true;
    }

    /**
     * Adds a relation edge {@code from::relation::to}, or merges the properties
     * into the existing edge with that id.
     */
    public void relate(String fromId, String toId, String relation, Map<String, Object> properties) {
        synchronized (this) {
            link(fromId, toId, relation, properties);
        }
        scheduleSave();
    }

    public synchronized AuxiliaryGraph getKnowledgeGraph() {
        return AuxiliaryGraph.builder()
                .nodes(new ArrayList<>(nodes.values().stream().map(AuxiliaryGraph.Node::copy).toList()))
                .edges(new ArrayList<>(edges.values().stream().map(AuxiliaryGraph.Edge::copy).toList()))
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Writes both files now, cancelling any pending debounced save. No-op when
     * persistence is disabled.
     */
    public void flush() {
        if (!persistence.isEnabled()) {
            return;
        }
        String entriesJson;
        String graphJson;
        synchronized (this) {
            if (pendingSave != null) {
                pendingSave.cancel();
                pendingSave = null;
            }
            try {
                entriesJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entriesAsJson());
                graphJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(getKnowledgeGraph());
            } catch (JsonProcessingException e) {
                log.warn("[UnifiedStore] Failed to serialize snapshot: {}", e.getMessage());
                return;
            }
        }
        write(persistence.getStoreFile(), entriesJson);
        write(persistence.getKnowledgeGraphFile(), graphJson);
    }

    @PreDestroy
    public void shutdown() {
        boolean dirty;
        synchronized (this) {
            dirty = pendingSave != null;
        }
        if (dirty) {
            flush();
        }
    }

    private void project(String id, TaggedArtifact artifact) {
        if (!nodes.containsKey(id)) {
            nodes.put(id, AuxiliaryGraph.Node.builder()
                    .id(id)
                    .type(artifact.type().getWireName())
                    .build());
        }
        String key = artifact.data().correlationKey();
        if (key != null && !key.isBlank()) {
            String sessionNodeId = SESSION_NODE_PREFIX + key;
            if (!nodes.containsKey(sessionNodeId)) {
                nodes.put(sessionNodeId, AuxiliaryGraph.Node.builder()
                        .id(sessionNodeId)
                        .type(CONCEPT_TYPE)
                        .labels(new ArrayList<>(List.of(SESSION_LABEL)))
                        .build());
            }
            link(sessionNodeId, id, HAS_ITEM, null);
        }
        addLabel(id, artifact.type().getWireName());
    }

    private boolean addLabel(String nodeId, String label) {
        AuxiliaryGraph.Node node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        Set<String> labels = new LinkedHashSet<>(node.getLabels() == null ? List.of() : node.getLabels());
        labels.add(label);
        node.setLabels(new ArrayList<>(labels));
        return true;
    }

    private void link(String fromId, String toId, String relation, Map<String, Object> properties) {
        String edgeId = fromId + "::" + relation + "::" + toId;
        AuxiliaryGraph.Edge existing = edges.get(edgeId);
        if (existing != null) {
            if (properties != null) {
                Map<String, Object> merged = new LinkedHashMap<>(
                        existing.getProperties() == null ? Map.of() : existing.getProperties());
                merged.putAll(properties);
                existing.setProperties(merged);
            }
            return;
        }
        edges.put(edgeId, AuxiliaryGraph.Edge.builder()
                .id(edgeId)
                .from(fromId)
                .to(toId)
                .relation(relation)
                .properties(properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties))
                .build());
    }

    private void scheduleSave() {
        if (!persistence.isEnabled()) {
            return;
        }
        synchronized (this) {
            if (pendingSave != null) {
                pendingSave.cancel();
            }
            pendingSave = scheduler.schedule(this::flush, persistence.getDebounce());
        }
    }

    private ArrayNode entriesAsJson() {
        ArrayNode array = objectMapper.createArrayNode();
        entries.forEach((id, artifact) -> {
            ObjectNode item = objectMapper.createObjectNode();
            item.put("type", artifact.type().getWireName());
            item.set("data", objectMapper.valueToTree(artifact.data()));
            ArrayNode pair = objectMapper.createArrayNode();
            pair.add(id);
            pair.add(item);
            array.add(pair);
        });
        return array;
    }

    private void write(String file, String json) {
        try {
            storagePort.writeAtomic(persistence.getDirectory(), file, json).join();
            log.debug("[UnifiedStore] Saved {}", file);
        } catch (RuntimeException e) {
            log.warn("[UnifiedStore] Failed to save {}: {}", file, e.getMessage());
        }
    }

    private void loadEntries() {
        String json = readQuietly(persistence.getStoreFile());
        if (json == null) {
            return;
        }
        Map<String, TaggedArtifact> loaded = new LinkedHashMap<>();
        try {
            JsonNode root = objectMapper.readTree(json);
            if (!root.isArray()) {
                log.warn("[UnifiedStore] Ignoring {}: not a JSON array", persistence.getStoreFile());
                return;
            }
            for (JsonNode pair : root) {
                String id = pair.path(0).asText(null);
                JsonNode item = pair.path(1);
                Optional<ArtifactKind> kind = ArtifactKind.fromWireName(item.path("type").asText(null));
                if (id == null || kind.isEmpty()) {
                    log.warn("[UnifiedStore] Skipping malformed entry in {}", persistence.getStoreFile());
                    continue;
                }
                ReasoningArtifact data = objectMapper.treeToValue(item.path("data"), kind.get().getArtifactClass());
                loaded.put(id, new TaggedArtifact(kind.get(), data));
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[UnifiedStore] Ignoring unreadable {}: {}", persistence.getStoreFile(), e.getMessage());
            return;
        }
        synchronized (this) {
            entries.putAll(loaded);
        }
    }

    private void loadGraph() {
        String json = readQuietly(persistence.getKnowledgeGraphFile());
        if (json == null) {
            return;
        }
        AuxiliaryGraph graph;
        try {
            graph = objectMapper.readValue(json, AuxiliaryGraph.class);
        } catch (JsonProcessingException e) {
            log.warn("[UnifiedStore] Ignoring unreadable {}: {}", persistence.getKnowledgeGraphFile(),
                    e.getMessage());
            return;
        }
        synchronized (this) {
            if (graph.getNodes() != null) {
                graph.getNodes().forEach(n -> nodes.put(n.getId(), n));
            }
            if (graph.getEdges() != null) {
                graph.getEdges().forEach(e -> edges.put(e.getId(), e));
            }
        }
    }

    private String readQuietly(String file) {
        try {
            return storagePort.read(persistence.getDirectory(), file).join().orElse(null);
        } catch (RuntimeException e) {
            log.warn("[UnifiedStore] Failed to read {}: {}", file, e.getMessage());
            return null;
        }
    }
}
