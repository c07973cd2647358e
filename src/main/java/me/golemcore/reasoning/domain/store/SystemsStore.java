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

import me.golemcore.reasoning.domain.model.SystemsAnalysis;

import java.util.List;

public class SystemsStore extends TypedStore<SystemsAnalysis> {

    private final KeyedIndex<SystemsAnalysis> bySystem = registerIndex(KeyedIndex.single(SystemsAnalysis::getSystem));

    public SystemsStore() {
        super("systems");
    }

    public synchronized List<SystemsAnalysis> getBySystem(String system) {
        return resolve(bySystem.idsFor(system));
    }

    public synchronized Statistics getStatistics() {
        List<SystemsAnalysis> all = getAll();
        int components = all.stream().mapToInt(a -> sizeOf(a.getComponents())).sum();
        int loops = all.stream().mapToInt(a -> sizeOf(a.getFeedbackLoops())).sum();
        int leveragePoints = all.stream().mapToInt(a -> sizeOf(a.getLeveragePoints())).sum();
        return new Statistics(all.size(), bySystem.keys().size(), components, loops, leveragePoints);
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    public record Statistics(int totalAnalyses, int systems, int components, int feedbackLoops,
            int leveragePoints) {
    }
}
