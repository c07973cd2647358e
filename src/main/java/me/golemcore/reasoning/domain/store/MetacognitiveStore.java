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

import me.golemcore.reasoning.domain.model.MetacognitiveAssessment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class MetacognitiveStore extends TypedStore<MetacognitiveAssessment> {

    private final KeyedIndex<MetacognitiveAssessment> byTask = registerIndex(
            KeyedIndex.single(MetacognitiveAssessment::getTask));
    private final KeyedIndex<MetacognitiveAssessment> byDomain = registerIndex(
            KeyedIndex.single(MetacognitiveAssessment::getKnowledgeDomain));

    public MetacognitiveStore() {
        super("metacognitive");
    }

    public synchronized List<MetacognitiveAssessment> getByTask(String task) {
        return resolve(byTask.idsFor(task));
    }

    public synchronized List<MetacognitiveAssessment> getByDomain(String domain) {
        return resolve(byDomain.idsFor(domain));
    }

    public List<MetacognitiveAssessment> getByStage(String stage) {
        return filter(a -> stage.equals(a.getStage()));
    }

    public Optional<MetacognitiveAssessment> getByMonitoringId(String monitoringId) {
        return find(a -> monitoringId.equals(a.getMonitoringId()));
    }

    public List<MetacognitiveAssessment> getLowConfidence(double threshold) {
        return filter(a -> a.getOverallConfidence() < threshold);
    }

    public synchronized Statistics getStatistics() {
        List<MetacognitiveAssessment> all = getAll();
        double avgConfidence = all.stream().mapToDouble(MetacognitiveAssessment::getOverallConfidence)
                .average()
                .orElse(0);
        Map<String, Integer> stages = new LinkedHashMap<>();
        for (MetacognitiveAssessment assessment : all) {
            if (assessment.getStage() != null) {
                stages.merge(assessment.getStage(), 1, Integer::sum);
            }
        }
        return new Statistics(all.size(), byTask.keys().size(), byDomain.keys().size(), avgConfidence, stages);
    }

    public record Statistics(int totalSessions, int tasks, int assessedDomains, double averageConfidence,
            Map<String, Integer> stages) {
    }
}
