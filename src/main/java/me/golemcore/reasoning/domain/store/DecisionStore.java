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

import me.golemcore.reasoning.domain.model.Decision;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decision analyses indexed by analysis type and by the keywords of their
 * statement.
 */
public class DecisionStore extends TypedStore<Decision> {

    static final String STAGE_COMPLETE = "complete";

    private final KeyedIndex<Decision> byAnalysisType = registerIndex(KeyedIndex.single(Decision::getAnalysisType));
    private final KeywordIndex<Decision> byStatement = registerIndex(
            new KeywordIndex<>(Decision::getDecisionStatement));

    public DecisionStore() {
        super("decisions");
    }

    public synchronized List<Decision> searchDecisions(String keywords) {
        return resolve(byStatement.search(keywords));
    }

    public synchronized List<Decision> getByAnalysisType(String analysisType) {
        return resolve(byAnalysisType.idsFor(analysisType));
    }

    public List<Decision> getByStage(String stage) {
        return filter(d -> stage.equals(d.getStage()));
    }

    public Optional<Decision> getByDecisionId(String decisionId) {
        return find(d -> decisionId.equals(d.getDecisionId()));
    }

    public List<Decision> getCompleted() {
        return filter(d -> STAGE_COMPLETE.equals(d.getStage()) || !d.isNextStageNeeded());
    }

    public List<Decision> getActive() {
        return filter(d -> d.isNextStageNeeded() && !STAGE_COMPLETE.equals(d.getStage()));
    }

    public Map<String, Integer> getStageDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (Decision decision : getAll()) {
            if (decision.getStage() != null) {
                distribution.merge(decision.getStage(), 1, Integer::sum);
            }
        }
        return distribution;
    }

    public synchronized Statistics getStatistics() {
        double avgOptions = getAll().stream()
                .mapToInt(d -> d.getOptions() == null ? 0 : d.getOptions().size())
                .average()
                .orElse(0);
        return new Statistics(size(), getActive().size(), getCompleted().size(), avgOptions,
                byAnalysisType.counts(), getStageDistribution());
    }

    public record Statistics(int totalDecisions, int activeDecisions, int completedDecisions,
            double averageOptions, Map<String, Integer> analysisTypes, Map<String, Integer> stages) {
    }
}
