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

import me.golemcore.reasoning.domain.model.MentalModelApplication;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class MentalModelStore extends TypedStore<MentalModelApplication> {

    private final KeyedIndex<MentalModelApplication> byModel = registerIndex(
            KeyedIndex.single(MentalModelApplication::getModelName));

    public MentalModelStore() {
        super("mentalModels");
    }

    public synchronized List<MentalModelApplication> getByModel(String modelName) {
        return resolve(byModel.idsFor(modelName));
    }

    public Set<String> getUniqueProblems() {
        Set<String> problems = new LinkedHashSet<>();
        for (MentalModelApplication application : getAll()) {
            if (application.getProblem() != null) {
                problems.add(application.getProblem());
            }
        }
        return problems;
    }

    public synchronized Optional<String> getMostUsedModel() {
        return byModel.counts().entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey);
    }

    public synchronized Statistics getStatistics() {
        return new Statistics(size(), byModel.counts());
    }

    public record Statistics(int total, Map<String, Integer> modelUsage) {
    }
}
