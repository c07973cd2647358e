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

import me.golemcore.reasoning.domain.model.CreativeSession;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class CreativeStore extends TypedStore<CreativeSession> {

    private final KeyedIndex<CreativeSession> byTechnique = registerIndex(
            new KeyedIndex<>(CreativeSession::getTechniques));

    public CreativeStore() {
        super("creative");
    }

    public synchronized List<CreativeSession> getByTechnique(String technique) {
        return resolve(byTechnique.idsFor(technique));
    }

    public synchronized Set<String> getAllTechniques() {
        return byTechnique.keys();
    }

    public List<CreativeSession> getActive() {
        return filter(CreativeSession::isNextIdeaNeeded);
    }

    public synchronized Statistics getStatistics() {
        List<CreativeSession> all = getAll();
        int ideas = all.stream().mapToInt(s -> s.getIdeas() == null ? 0 : s.getIdeas().size()).sum();
        int insights = all.stream().mapToInt(s -> s.getInsights() == null ? 0 : s.getInsights().size()).sum();
        double avgIdeas = all.isEmpty() ? 0 : (double) ideas / all.size();
        return new Statistics(all.size(), ideas, insights, avgIdeas, byTechnique.counts());
    }

    public record Statistics(int totalSessions, int totalIdeas, int totalInsights, double averageIdeas,
            Map<String, Integer> techniqueUsage) {
    }
}
