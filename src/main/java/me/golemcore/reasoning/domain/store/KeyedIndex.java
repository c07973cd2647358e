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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps exact keys extracted from an item (topic, approach name, diagram id,
 * ...) to the ids of the items carrying them. Items yielding no key are not
 * indexed. Keys and ids keep insertion order.
 */
public class KeyedIndex<T> implements StoreIndex<T> {

    private final Function<T, Collection<String>> keyExtractor;
    private final Map<String, Set<String>> ids = new LinkedHashMap<>();

    public KeyedIndex(Function<T, Collection<String>> keyExtractor) {
        this.keyExtractor = keyExtractor;
    }

    /**
     * Index on a single, possibly null, key.
     */
    public static <T> KeyedIndex<T> single(Function<T, String> keyExtractor) {
        return new KeyedIndex<>(item -> {
            String key = keyExtractor.apply(item);
            return key == null ? List.of() : List.of(key);
        });
    }

    @Override
    public void add(String id, T item) {
        for (String key : keysOf(item)) {
            ids.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
        }
    }

    @Override
    public void remove(String id, T item) {
        for (String key : keysOf(item)) {
            Set<String> bucket = ids.get(key);
            if (bucket != null) {
                bucket.remove(id);
                if (bucket.isEmpty()) {
                    ids.remove(key);
                }
            }
        }
    }

    @Override
    public void clear() {
        ids.clear();
    }

    public Set<String> idsFor(String key) {
        Set<String> bucket = ids.get(key);
        return bucket == null ? Set.of() : new LinkedHashSet<>(bucket);
    }

    public Set<String> keys() {
        return new LinkedHashSet<>(ids.keySet());
    }

    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        ids.forEach((key, bucket) -> counts.put(key, bucket.size()));
        return counts;
    }

    private Collection<String> keysOf(T item) {
        Collection<String> keys = keyExtractor.apply(item);
        if (keys == null) {
            return List.of();
        }
        return keys.stream().filter(k -> k != null && !k.isBlank()).toList();
    }
}
