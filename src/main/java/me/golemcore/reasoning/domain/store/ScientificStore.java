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

import me.golemcore.reasoning.domain.model.ScientificInquiry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scientific-method stages indexed by inquiry, hypothesis and experiment id.
 * The most recent stage mentioning a hypothesis or experiment wins.
 */
public class ScientificStore extends TypedStore<ScientificInquiry> {

    static final String STAGE_CONCLUSION = "conclusion";

    private final KeyedIndex<ScientificInquiry> byInquiry = registerIndex(
            KeyedIndex.single(ScientificInquiry::getInquiryId));
    private final KeyedIndex<ScientificInquiry> byHypothesis = registerIndex(KeyedIndex.single(
            i -> i.getHypothesis() == null ? null : i.getHypothesis().getHypothesisId()));
    private final KeyedIndex<ScientificInquiry> byExperiment = registerIndex(KeyedIndex.single(
            i -> i.getExperiment() == null ? null : i.getExperiment().getExperimentId()));

    public ScientificStore() {
        super("scientific");
    }

    public synchronized List<ScientificInquiry> getByInquiry(String inquiryId) {
        return resolve(byInquiry.idsFor(inquiryId));
    }

    public List<ScientificInquiry> getByStage(String stage) {
        return filter(i -> stage.equals(i.getStage()));
    }

    public synchronized Optional<ScientificInquiry.Hypothesis> getHypothesis(String hypothesisId) {
        List<ScientificInquiry> stages = resolve(byHypothesis.idsFor(hypothesisId));
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1).getHypothesis());
    }

    public synchronized Optional<ScientificInquiry.Experiment> getExperiment(String experimentId) {
        List<ScientificInquiry> stages = resolve(byExperiment.idsFor(experimentId));
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1).getExperiment());
    }

    public List<ScientificInquiry> getActive() {
        return filter(ScientificInquiry::isNextStageNeeded);
    }

    public List<ScientificInquiry> getCompleted() {
        return filter(i -> STAGE_CONCLUSION.equals(i.getStage()) && i.getConclusion() != null);
    }

    public Map<String, Integer> getStageDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (ScientificInquiry inquiry : getAll()) {
            if (inquiry.getStage() != null) {
                distribution.merge(inquiry.getStage(), 1, Integer::sum);
            }
        }
        return distribution;
    }

    public synchronized Statistics getStatistics() {
        return new Statistics(size(), byInquiry.keys().size(), byHypothesis.keys().size(),
                byExperiment.keys().size(), getCompleted().size(), getStageDistribution());
    }

    public record Statistics(int totalStages, int inquiries, int hypotheses, int experiments,
            int completedInquiries, Map<String, Integer> stages) {
    }
}
