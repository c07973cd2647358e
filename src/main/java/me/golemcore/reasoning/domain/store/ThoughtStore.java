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

import me.golemcore.reasoning.domain.model.ThoughtData;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Thoughts of a sequential-thinking session, indexed by branch and by the
 * thought number they revise.
 */
public class ThoughtStore extends TypedStore<ThoughtData> {

    private static final Comparator<ThoughtData> BY_NUMBER = Comparator.comparingInt(ThoughtData::getThoughtNumber);

    private final KeyedIndex<ThoughtData> branches = registerIndex(KeyedIndex.single(ThoughtData::getBranchId));
    private final KeyedIndex<ThoughtData> revisions = registerIndex(KeyedIndex.single(ThoughtStore::revisionKey));

    public ThoughtStore() {
        super("thoughts");
    }

    /**
     * All thoughts ordered by thought number; ties keep insertion order.
     */
    public List<ThoughtData> getOrdered() {
        return getAll().stream().sorted(BY_NUMBER).toList();
    }

    public synchronized List<ThoughtData> getBranch(String branchId) {
        return resolve(branches.idsFor(branchId));
    }

    public synchronized Set<String> getBranchIds() {
        return branches.keys();
    }

    public synchronized List<ThoughtData> getRevisions(int thoughtNumber) {
        return resolve(revisions.idsFor(String.valueOf(thoughtNumber)));
    }

    public Optional<ThoughtData> getLatest() {
        return getAll().stream().max(BY_NUMBER);
    }

    public List<ThoughtData> getRange(int start, int end) {
        return getOrdered().stream()
                .filter(t -> t.getThoughtNumber() >= start && t.getThoughtNumber() <= end)
                .toList();
    }

    public List<ThoughtData> getPending() {
        return filter(ThoughtData::isNextThoughtNeeded);
    }

    public synchronized Statistics getStatistics() {
        List<ThoughtData> thoughts = getAll();
        int revisionCount = (int) thoughts.stream().filter(ThoughtStore::isRevision).count();
        int branched = (int) thoughts.stream().filter(t -> t.getBranchId() != null).count();
        int regular = (int) thoughts.stream()
                .filter(t -> !isRevision(t) && t.getBranchId() == null)
                .count();
        return new Statistics(thoughts.size(), regular, revisionCount, branched, branches.keys().size());
    }

    private static boolean isRevision(ThoughtData thought) {
        return Boolean.TRUE.equals(thought.getIsRevision());
    }

    private static String revisionKey(ThoughtData thought) {
        if (isRevision(thought) && thought.getRevisesThought() != null) {
            return String.valueOf(thought.getRevisesThought());
        }
        return null;
    }

    public record Statistics(int total, int regular, int revisions, int branched, int branches) {
    }
}
