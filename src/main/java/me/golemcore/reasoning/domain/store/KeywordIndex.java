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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Word index over a free-text field. Text is lower-cased and split on
 * whitespace; only words longer than {@value #MIN_KEYWORD_LENGTH} characters
 * are indexed.
 */
public class KeywordIndex<T> implements StoreIndex<T> {

    static final int MIN_KEYWORD_LENGTH = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Function<T, String> textExtractor;
    private final Map<String, Set<String>> ids = new LinkedHashMap<>();

    public KeywordIndex(Function<T, String> textExtractor) {
        this.textExtractor = textExtractor;
    }

    @Override
    public void add(String id, T item) {
        for (String keyword : keywords(textExtractor.apply(item))) {
            ids.computeIfAbsent(keyword, k -> new LinkedHashSet<>()).add(id);
        }
    }

    @Override
    public void remove(String id, T item) {
        for (String keyword : keywords(textExtractor.apply(item))) {
            Set<String> bucket = ids.get(keyword);
            if (bucket != null) {
                bucket.remove(id);
                if (bucket.isEmpty()) {
                    ids.remove(keyword);
                }
            }
        }
    }

    @Override
    public void clear() {
        ids.clear();
    }

    /**
     * Ids of items whose text contains any of the query terms.
     */
    public Set<String> search(String query) {
        Set<String> matches = new LinkedHashSet<>();
        if (query == null || query.isBlank()) {
            return matches;
        }
        for (String term : WHITESPACE.split(query.toLowerCase(Locale.ROOT).trim())) {
            Set<String> bucket = ids.get(term);
            if (bucket != null) {
                matches.addAll(bucket);
            }
        }
        return matches;
    }

    static Set<String> keywords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        for (String word : WHITESPACE.split(text.toLowerCase(Locale.ROOT).trim())) {
            if (word.length() > MIN_KEYWORD_LENGTH) {
                words.add(word);
            }
        }
        return words;
    }
}
