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

import me.golemcore.reasoning.domain.model.CollaborativeSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class CollaborativeStore extends TypedStore<CollaborativeSession> {

    private final KeyedIndex<CollaborativeSession> byTopic = registerIndex(
            KeyedIndex.single(CollaborativeSession::getTopic));
    private final KeyedIndex<CollaborativeSession> byPersona = registerIndex(new KeyedIndex<>(
            session -> session.getPersonas() == null ? List.of()
                    : session.getPersonas().stream().map(CollaborativeSession.Persona::getId).toList()));

    public CollaborativeStore() {
        super("collaborative");
    }

    /**
     * Sessions whose topic matches exactly, followed by sessions whose topic
     * contains the query case-insensitively.
     */
    public synchronized List<CollaborativeSession> getByTopic(String topic) {
        List<CollaborativeSession> result = new ArrayList<>(resolve(byTopic.idsFor(topic)));
        String needle = topic.toLowerCase(Locale.ROOT);
        for (CollaborativeSession session : getAll()) {
            if (session.getTopic() != null && !result.contains(session)
                    && session.getTopic().toLowerCase(Locale.ROOT).contains(needle)) {
                result.add(session);
            }
        }
        return result;
    }

    public synchronized List<CollaborativeSession> getByPersona(String personaId) {
        return resolve(byPersona.idsFor(personaId));
    }

    public Optional<CollaborativeSession> getBySessionId(String sessionId) {
        return find(s -> sessionId.equals(s.getSessionId()));
    }

    public synchronized Statistics getStatistics() {
        int contributions = getAll().stream()
                .mapToInt(s -> s.getContributions() == null ? 0 : s.getContributions().size())
                .sum();
        return new Statistics(size(), byTopic.keys().size(), contributions, byPersona.counts());
    }

    public record Statistics(int totalSessions, int topics, int contributions,
            Map<String, Integer> personaParticipation) {
    }
}
