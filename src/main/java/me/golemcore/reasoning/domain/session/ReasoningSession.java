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

package me.golemcore.reasoning.domain.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.exception.ValidationException;
import me.golemcore.reasoning.domain.graph.DeploymentMode;
import me.golemcore.reasoning.domain.graph.KnowledgeGraph;
import me.golemcore.reasoning.domain.model.Argument;
import me.golemcore.reasoning.domain.model.ArtifactKind;
import me.golemcore.reasoning.domain.model.CollaborativeSession;
import me.golemcore.reasoning.domain.model.CreativeSession;
import me.golemcore.reasoning.domain.model.DebuggingSession;
import me.golemcore.reasoning.domain.model.Decision;
import me.golemcore.reasoning.domain.model.MentalModelApplication;
import me.golemcore.reasoning.domain.model.MetacognitiveAssessment;
import me.golemcore.reasoning.domain.model.ReasoningArtifact;
import me.golemcore.reasoning.domain.model.ScientificInquiry;
import me.golemcore.reasoning.domain.model.SessionExport;
import me.golemcore.reasoning.domain.model.SessionStatistics;
import me.golemcore.reasoning.domain.model.SystemsAnalysis;
import me.golemcore.reasoning.domain.model.TaggedArtifact;
import me.golemcore.reasoning.domain.model.ThoughtData;
import me.golemcore.reasoning.domain.model.VisualOperation;
import me.golemcore.reasoning.domain.store.ArgumentStore;
import me.golemcore.reasoning.domain.store.CollaborativeStore;
import me.golemcore.reasoning.domain.store.CreativeStore;
import me.golemcore.reasoning.domain.store.DebuggingStore;
import me.golemcore.reasoning.domain.store.DecisionStore;
import me.golemcore.reasoning.domain.store.MentalModelStore;
import me.golemcore.reasoning.domain.store.MetacognitiveStore;
import me.golemcore.reasoning.domain.store.ScientificStore;
import me.golemcore.reasoning.domain.store.StoreGuard;
import me.golemcore.reasoning.domain.store.SystemsStore;
import me.golemcore.reasoning.domain.store.ThoughtStore;
import me.golemcore.reasoning.domain.store.TypedStore;
import me.golemcore.reasoning.domain.store.VisualStore;
import me.golemcore.reasoning.port.outbound.SchedulerPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * One reasoning session: a typed store per artifact kind, the session's
 * knowledge graphs, and an idle clock.
 *
 * <p>
 * Every mutator and every accessor of artifacts, statistics or graphs re-arms
 * the idle clock; the plain identity getters do not. When the clock fires, or
 * on {@link #cleanup()}, the session terminates: stores and graphs are emptied
 * and the termination callback runs once. A terminated session stays
 * terminated; its mutators return {@code false} and its accessors no longer
 * re-arm the clock.
 *
 * <p>
 * Every kind has a capacity from the {@link CapacityPolicy}. An add beyond the
 * ceiling stores nothing and returns {@code false}. The stores handed out by
 * the accessors enforce the same rules, so adding through them also respects
 * the ceiling, reaches the {@link ArtifactListener} and fails after
 * termination.
 */
@Slf4j
public class ReasoningSession {

    private final String id;
    private final Settings settings;
    private final SchedulerPort scheduler;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ArtifactListener listener;
    private final Consumer<ReasoningSession> onTerminated;
    private final Instant createdAt;

    private final ThoughtStore thoughts = new ThoughtStore();
    private final MentalModelStore mentalModels = new MentalModelStore();
    private final DebuggingStore debugging = new DebuggingStore();
    private final CollaborativeStore collaborative = new CollaborativeStore();
    private final DecisionStore decisions = new DecisionStore();
    private final MetacognitiveStore metacognitive = new MetacognitiveStore();
    private final ScientificStore scientific = new ScientificStore();
    private final CreativeStore creative = new CreativeStore();
    private final SystemsStore systems = new SystemsStore();
    private final VisualStore visual = new VisualStore();
    private final ArgumentStore arguments = new ArgumentStore();
    private final Map<ArtifactKind, TypedStore<? extends ReasoningArtifact>> stores = new EnumMap<>(
            ArtifactKind.class);

    private final Map<String, KnowledgeGraph> knowledgeGraphs = new LinkedHashMap<>();

    private volatile Instant lastAccessedAt;
    private volatile boolean terminated;
    private SchedulerPort.ScheduledTask idleTask;
    private long clockGeneration;

    public ReasoningSession(String id, Settings settings, SchedulerPort scheduler, Clock clock,
            ObjectMapper objectMapper, ArtifactListener listener, Consumer<ReasoningSession> onTerminated) {
        this.id = id;
        this.settings = settings;
        this.scheduler = scheduler;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.listener = listener == null ? ArtifactListener.NONE : listener;
        this.onTerminated = onTerminated == null ? s -> {
        } : onTerminated;
        this.createdAt = clock.instant();
        this.lastAccessedAt = createdAt;

        stores.put(ArtifactKind.THOUGHT, thoughts);
        stores.put(ArtifactKind.MENTAL_MODEL, mentalModels);
        stores.put(ArtifactKind.DEBUGGING, debugging);
        stores.put(ArtifactKind.COLLABORATIVE, collaborative);
        stores.put(ArtifactKind.DECISION, decisions);
        stores.put(ArtifactKind.METACOGNITIVE, metacognitive);
        stores.put(ArtifactKind.SCIENTIFIC, scientific);
        stores.put(ArtifactKind.CREATIVE, creative);
        stores.put(ArtifactKind.SYSTEMS, systems);
        stores.put(ArtifactKind.VISUAL, visual);
        stores.put(ArtifactKind.ARGUMENT, arguments);
        stores.forEach((kind, store) -> store.setGuard(new SessionGuard(kind)));

        armIdleClock();
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public Duration getTimeout() {
        return settings.timeout();
    }

    /**
     * True while the idle clock is armed, that is until the session terminates.
     */
    public boolean isActive() {
        return !terminated;
    }

    /**
     * Re-arms the idle clock. No effect on a terminated session.
     */
    public synchronized void touch() {
        if (terminated) {
            return;
        }
        armIdleClock();
    }

    // Thoughts

    public boolean addThought(ThoughtData thought) {
        return store(ArtifactKind.THOUGHT, thoughts, thought);
    }

    public List<ThoughtData> getThoughts() {
        touch();
        return thoughts.getAll();
    }

    public int getRemainingThoughts() {
        return getRemainingCapacity(ArtifactKind.THOUGHT);
    }

    /**
     * Room left for the given kind, {@link Integer#MAX_VALUE} when unbounded.
     */
    public int getRemainingCapacity(ArtifactKind kind) {
        touch();
        return settings.capacityPolicy().remaining(kind, stores.get(kind).size());
    }

    public ThoughtStore getThoughtStore() {
        touch();
        return thoughts;
    }

    // Mental models

    public boolean addMentalModel(MentalModelApplication model) {
        return store(ArtifactKind.MENTAL_MODEL, mentalModels, model);
    }

    public List<MentalModelApplication> getMentalModels() {
        touch();
        return mentalModels.getAll();
    }

    public MentalModelStore getMentalModelStore() {
        touch();
        return mentalModels;
    }

    // Debugging

    public boolean addDebuggingSession(DebuggingSession session) {
        return store(ArtifactKind.DEBUGGING, debugging, session);
    }

    public List<DebuggingSession> getDebuggingSessions() {
        touch();
        return debugging.getAll();
    }

    public DebuggingStore getDebuggingStore() {
        touch();
        return debugging;
    }

    // Collaborative reasoning

    public boolean addCollaborativeSession(CollaborativeSession session) {
        return store(ArtifactKind.COLLABORATIVE, collaborative, session);
    }

    public List<CollaborativeSession> getCollaborativeSessions() {
        touch();
        return collaborative.getAll();
    }

    public Optional<CollaborativeSession> getCollaborativeSession(String sessionId) {
        touch();
        return collaborative.getBySessionId(sessionId);
    }

    public CollaborativeStore getCollaborativeStore() {
        touch();
        return collaborative;
    }

    // Decisions

    public boolean addDecision(Decision decision) {
        return store(ArtifactKind.DECISION, decisions, decision);
    }

    public List<Decision> getDecisions() {
        touch();
        return decisions.getAll();
    }

    public Optional<Decision> getDecision(String decisionId) {
        touch();
        return decisions.getByDecisionId(decisionId);
    }

    public DecisionStore getDecisionStore() {
        touch();
        return decisions;
    }

    // Metacognitive monitoring

    public boolean addMetacognitive(MetacognitiveAssessment assessment) {
        return store(ArtifactKind.METACOGNITIVE, metacognitive, assessment);
    }

    public List<MetacognitiveAssessment> getMetacognitiveSessions() {
        touch();
        return metacognitive.getAll();
    }

    public Optional<MetacognitiveAssessment> getMetacognitiveSession(String monitoringId) {
        touch();
        return metacognitive.getByMonitoringId(monitoringId);
    }

    public MetacognitiveStore getMetacognitiveStore() {
        touch();
        return metacognitive;
    }

    // Scientific method

    public boolean addScientificInquiry(ScientificInquiry inquiry) {
        return store(ArtifactKind.SCIENTIFIC, scientific, inquiry);
    }

    public List<ScientificInquiry> getScientificInquiries() {
        touch();
        return scientific.getAll();
    }

    public Optional<ScientificInquiry> getScientificInquiry(String inquiryId) {
        touch();
        return scientific.find(i -> inquiryId.equals(i.getInquiryId()));
    }

    public ScientificStore getScientificStore() {
        touch();
        return scientific;
    }

    // Creative thinking

    public boolean addCreativeSession(CreativeSession session) {
        return store(ArtifactKind.CREATIVE, creative, session);
    }

    public List<CreativeSession> getCreativeSessions() {
        touch();
        return creative.getAll();
    }

    public CreativeStore getCreativeStore() {
        touch();
        return creative;
    }

    // Systems thinking

    public boolean addSystemsAnalysis(SystemsAnalysis analysis) {
        return store(ArtifactKind.SYSTEMS, systems, analysis);
    }

    public List<SystemsAnalysis> getSystemsAnalyses() {
        touch();
        return systems.getAll();
    }

    public SystemsStore getSystemsStore() {
        touch();
        return systems;
    }

    // Visual reasoning

    public boolean addVisualOperation(VisualOperation operation) {
        return store(ArtifactKind.VISUAL, visual, operation);
    }

    public List<VisualOperation> getVisualOperations() {
        touch();
        return visual.getAll();
    }

    /**
     * Every operation recorded for the diagram, in insertion order.
     */
    public List<VisualOperation> getVisualDiagram(String diagramId) {
        touch();
        return visual.getByDiagram(diagramId);
    }

    public VisualStore getVisualStore() {
        touch();
        return visual;
    }

    // Argumentation

    public boolean addArgument(Argument argument) {
        return store(ArtifactKind.ARGUMENT, arguments, argument);
    }

    public List<Argument> getArguments() {
        touch();
        return arguments.getAll();
    }

    public ArgumentStore getArgumentStore() {
        touch();
        return arguments;
    }

    // Knowledge graphs

    public KnowledgeGraph getKnowledgeGraph() {
        return getKnowledgeGraph(null, null);
    }

    /**
     * Returns the graph registered under {@code graphId}, creating it with the
     * given mode if absent. A null id means the session id, a null mode the
     * configured default. The mode of an existing graph is never changed.
     *
     * @throws ValidationException
     *             if the session has terminated
     */
    public synchronized KnowledgeGraph getKnowledgeGraph(String graphId, DeploymentMode mode) {
        requireActive();
        touch();
        String key = graphId == null ? id : graphId;
        return knowledgeGraphs.computeIfAbsent(key,
                k -> new KnowledgeGraph(k, mode == null ? settings.defaultGraphMode() : mode, clock));
    }

    public synchronized boolean setKnowledgeGraph(String graphId, KnowledgeGraph graph) {
        if (terminated) {
            return false;
        }
        touch();
        knowledgeGraphs.put(graphId == null ? id : graphId, graph);
        return true;
    }

    public synchronized Optional<String> serializeKnowledgeGraph(String graphId) {
        touch();
        KnowledgeGraph graph = knowledgeGraphs.get(graphId == null ? id : graphId);
        return graph == null ? Optional.empty() : Optional.of(graph.serialize(objectMapper));
    }

    /**
     * Restores a graph from its JSON snapshot and registers it under
     * {@code graphId} (the session id when null), replacing any existing one.
     */
    public synchronized KnowledgeGraph deserializeKnowledgeGraph(String json, String graphId) {
        requireActive();
        touch();
        KnowledgeGraph graph = KnowledgeGraph.deserialize(json, objectMapper, clock);
        knowledgeGraphs.put(graphId == null ? id : graphId, graph);
        return graph;
    }

    public synchronized List<String> getKnowledgeGraphIds() {
        touch();
        return new ArrayList<>(knowledgeGraphs.keySet());
    }

    // Statistics, export and import

    public SessionStatistics getStats() {
        touch();
        List<String> toolsUsed = new ArrayList<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        int totalOperations = 0;
        for (Map.Entry<ArtifactKind, TypedStore<? extends ReasoningArtifact>> entry : stores.entrySet()) {
            int count = entry.getValue().size();
            counts.put(entry.getKey().getWireName(), count);
            if (count > 0) {
                toolsUsed.add(entry.getKey().getToolName());
                totalOperations += count;
            }
        }
        return SessionStatistics.builder()
                .sessionId(id)
                .createdAt(createdAt)
                .lastAccessedAt(lastAccessedAt)
                .thoughtCount(thoughts.size())
                .toolsUsed(toolsUsed)
                .totalOperations(totalOperations)
                .active(isActive())
                .remainingThoughts(getRemainingThoughts())
                .stores(counts)
                .build();
    }

    /**
     * Exports every stored artifact, grouped by kind in declaration order.
     */
    public List<SessionExport> export() {
        touch();
        Instant timestamp = clock.instant();
        List<SessionExport> exports = new ArrayList<>();
        for (ArtifactKind kind : ArtifactKind.values()) {
            exportKind(kind, timestamp, exports);
        }
        return exports;
    }

    public List<SessionExport> export(ArtifactKind kind) {
        touch();
        List<SessionExport> exports = new ArrayList<>();
        exportKind(kind, clock.instant(), exports);
        return exports;
    }

    /**
     * Exports one store by its store name ({@code thoughts},
     * {@code mentalModels}, {@code decisions}, ...). Unknown names yield an
     * empty list.
     */
    public List<SessionExport> exportStore(String storeName) {
        return ArtifactKind.fromStoreName(storeName).map(this::export).orElseGet(() -> {
            log.warn("[Session] {} export of unknown store '{}'", id, storeName);
            return List.of();
        });
    }

    /**
     * Replays exported records through the matching add operation. Records
     * with an unknown session type or unreadable data are skipped.
     *
     * @return the number of records stored
     */
    public int importData(List<SessionExport> records) {
        touch();
        int imported = 0;
        for (SessionExport record : records) {
            Optional<ArtifactKind> kind = record.getKind();
            if (kind.isEmpty()) {
                log.warn("[Session] {} skipped import of unknown type '{}'", id, record.getSessionType());
                continue;
            }
            ReasoningArtifact artifact;
            try {
                artifact = toArtifact(kind.get(), record.getData());
            } catch (IllegalArgumentException e) {
                log.warn("[Session] {} skipped unreadable {} record: {}", id, kind.get().getWireName(),
                        e.getMessage());
                continue;
            }
            if (add(kind.get(), artifact)) {
                imported++;
            }
        }
        log.debug("[Session] {} imported {} of {} records", id, imported, records.size());
        return imported;
    }

    /**
     * Stores an artifact of any kind through its typed add operation.
     */
    public boolean add(ReasoningArtifact artifact) {
        return add(ArtifactKind.of(artifact), artifact);
    }

    /**
     * Terminates the session: cancels the idle clock and empties every store
     * and graph. Idempotent.
     */
    public void cleanup() {
        if (terminate()) {
            log.info("[Session] {} terminated", id);
            onTerminated.accept(this);
        }
    }

    private boolean add(ArtifactKind kind, ReasoningArtifact artifact) {
        return switch (kind) {
        case THOUGHT -> addThought((ThoughtData) artifact);
        case MENTAL_MODEL -> addMentalModel((MentalModelApplication) artifact);
        case DEBUGGING -> addDebuggingSession((DebuggingSession) artifact);
        case COLLABORATIVE -> addCollaborativeSession((CollaborativeSession) artifact);
        case DECISION -> addDecision((Decision) artifact);
        case METACOGNITIVE -> addMetacognitive((MetacognitiveAssessment) artifact);
        case SCIENTIFIC -> addScientificInquiry((ScientificInquiry) artifact);
        case CREATIVE -> addCreativeSession((CreativeSession) artifact);
        case SYSTEMS -> addSystemsAnalysis((SystemsAnalysis) artifact);
        case VISUAL -> addVisualOperation((VisualOperation) artifact);
        case ARGUMENT -> addArgument((Argument) artifact);
        };
    }

    private <T extends ReasoningArtifact> boolean store(ArtifactKind kind, TypedStore<T> store, T item) {
        touch();
        return store.add(kind.getIdPrefix() + "-" + UUID.randomUUID(), item);
    }

    private void exportKind(ArtifactKind kind, Instant timestamp, List<SessionExport> into) {
        for (ReasoningArtifact artifact : stores.get(kind).getAll()) {
            into.add(SessionExport.builder()
                    .timestamp(timestamp)
                    .sessionId(id)
                    .sessionType(kind.getExportTag())
                    .data(artifact)
                    .build());
        }
    }

    private ReasoningArtifact toArtifact(ArtifactKind kind, Object data) {
        if (data == null) {
            throw new IllegalArgumentException("missing data");
        }
        if (kind.getArtifactClass().isInstance(data)) {
            return (ReasoningArtifact) data;
        }
        return objectMapper.convertValue(data, kind.getArtifactClass());
    }

    private void requireActive() {
        if (terminated) {
            throw new ValidationException("Session " + id + " has terminated");
        }
    }

    private void armIdleClock() {
        if (idleTask != null) {
            idleTask.cancel();
        }
        long generation = ++clockGeneration;
        lastAccessedAt = clock.instant();
        idleTask = scheduler.schedule(() -> expire(generation), settings.timeout());
    }

    private void expire(long generation) {
        boolean expired;
        synchronized (this) {
            expired = generation == clockGeneration && terminate();
        }
        if (expired) {
            log.info("[Session] {} idle for {}, terminated", id, settings.timeout());
            onTerminated.accept(this);
        }
    }

    private synchronized boolean terminate() {
        if (terminated) {
            return false;
        }
        terminated = true;
        if (idleTask != null) {
            idleTask.cancel();
            idleTask = null;
        }
        stores.values().forEach(TypedStore::clear);
        knowledgeGraphs.clear();
        return true;
    }

    /**
     * Enforces termination and capacity on every add to a session store, also
     * when a caller adds through the store handed out by an accessor.
     */
    private final class SessionGuard implements StoreGuard<ReasoningArtifact> {

        private final ArtifactKind kind;

        private SessionGuard(ArtifactKind kind) {
            this.kind = kind;
        }

        @Override
        public boolean admit(String artifactId, ReasoningArtifact item, int currentSize) {
            if (terminated) {
                log.debug("[Session] {} rejected {} after termination", id, kind.getWireName());
                return false;
            }
            if (settings.capacityPolicy().remaining(kind, currentSize) == 0) {
                log.debug("[Session] {} {} capacity ({}) reached", id, kind.getWireName(),
                        settings.capacityPolicy().limitFor(kind));
                return false;
            }
            return true;
        }

        @Override
        public void stored(String artifactId, ReasoningArtifact item) {
            listener.onArtifactStored(id, artifactId, new TaggedArtifact(kind, item));
        }
    }

    /**
     * Per-session configuration.
     *
     * @param timeout
     *            idle time after which the session terminates
     * @param capacityPolicy
     *            per-kind artifact ceilings
     * @param defaultGraphMode
     *            mode of knowledge graphs created without an explicit mode
     */
    public record Settings(Duration timeout, CapacityPolicy capacityPolicy, DeploymentMode defaultGraphMode) {
    }
}
