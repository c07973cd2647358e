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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.store.UnifiedArtifactStore;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import me.golemcore.reasoning.port.outbound.SchedulerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live reasoning sessions. A session is created on first use of its
 * id and leaves the registry when it terminates, so the next use of the same id
 * starts a fresh session.
 *
 * <p>
 * When unified persistence is enabled, every artifact stored by any session is
 * also appended to the {@link UnifiedArtifactStore}.
 */
@Service
@Slf4j
public class ReasoningSessionService {

    private final ReasoningProperties.SessionProperties sessionProperties;
    private final SchedulerPort scheduler;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ArtifactListener artifactListener;

    private final Map<String, ReasoningSession> sessions = new ConcurrentHashMap<>();

    public ReasoningSessionService(ReasoningProperties properties, SchedulerPort scheduler, Clock clock,
            ObjectMapper objectMapper, UnifiedArtifactStore unifiedStore) {
        this.sessionProperties = properties.getSession();
        this.scheduler = scheduler;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.artifactListener = unifiedStore.isPersistenceEnabled()
                ? (sessionId, artifactId, artifact) -> unifiedStore.add(artifactId, artifact)
                : ArtifactListener.NONE;
    }

    public ReasoningSession getOrCreate(String sessionId) {
        ReasoningSession session = sessions.compute(sessionId, (id, existing) -> {
            if (existing != null && existing.isActive()) {
                return existing;
            }
            log.info("[Session] Created session: {}", id);
            return newSession(id);
        });
        session.touch();
        return session;
    }

    public Optional<ReasoningSession> get(String sessionId) {
        ReasoningSession session = sessions.get(sessionId);
        if (session == null || !session.isActive()) {
            return Optional.empty();
        }
        session.touch();
        return Optional.of(session);
    }

    /**
     * Terminates and removes the session.
     *
     * @return {@code false} if no live session has that id
     */
    public boolean cleanup(String sessionId) {
        ReasoningSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.cleanup();
        sessions.remove(sessionId, session);
        return true;
    }

    public List<String> listSessions() {
        return sessions.values().stream()
                .filter(ReasoningSession::isActive)
                .map(ReasoningSession::getId)
                .toList();
    }

    public int activeCount() {
        return (int) sessions.values().stream().filter(ReasoningSession::isActive).count();
    }

    @PreDestroy
    public void shutdown() {
        List<ReasoningSession> live = new ArrayList<>(sessions.values());
        live.forEach(ReasoningSession::cleanup);
        sessions.clear();
        log.info("[Session] Cleaned up {} sessions on shutdown", live.size());
    }

    private ReasoningSession newSession(String id) {
        ReasoningSession.Settings settings = new ReasoningSession.Settings(
                sessionProperties.getTimeout(),
                CapacityPolicy.of(sessionProperties.getMaxThoughtsPerSession(), sessionProperties.getCapacities()),
                sessionProperties.getDefaultGraphMode());
        return new ReasoningSession(id, settings, scheduler, clock, objectMapper, artifactListener,
                terminated -> sessions.remove(terminated.getId(), terminated));
    }
}
