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

import me.golemcore.reasoning.domain.model.Argument;

import java.util.List;
import java.util.Map;

public class ArgumentStore extends TypedStore<Argument> {

    private final KeyedIndex<Argument> byType = registerIndex(KeyedIndex.single(Argument::getArgumentType));
    private final KeywordIndex<Argument> byClaim = registerIndex(new KeywordIndex<>(Argument::getClaim));

    public ArgumentStore() {
        super("argument");
    }

    public synchronized List<Argument> getByType(String argumentType) {
        return resolve(byType.idsFor(argumentType));
    }

    public synchronized List<Argument> getByClaimKeyword(String keywords) {
        return resolve(byClaim.search(keywords));
    }

    public List<Argument> getResponsesTo(String argumentId) {
        return filter(a -> argumentId.equals(a.getRespondsTo()));
    }

    public synchronized Statistics getStatistics() {
        List<Argument> all = getAll();
        double avgConfidence = all.stream().mapToDouble(Argument::getConfidence).average().orElse(0);
        long rebuttals = all.stream().filter(a -> a.getRespondsTo() != null).count();
        return new Statistics(all.size(), (int) rebuttals, avgConfidence, byType.counts());
    }

    public record Statistics(int totalArguments, int responses, double averageConfidence,
            Map<String, Integer> argumentTypes) {
    }
}
