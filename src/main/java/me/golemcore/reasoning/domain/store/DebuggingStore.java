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

import me.golemcore.reasoning.domain.model.DebuggingSession;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Debugging sessions indexed by approach and by the keywords of the issue they
 * addressed. Success ratios are computed from resolved sessions.
 */
public class DebuggingStore extends TypedStore<DebuggingSession> {

    private final KeyedIndex<DebuggingSession> byApproach = registerIndex(
            KeyedIndex.single(DebuggingSession::getApproachName));
    private final KeywordIndex<DebuggingSession> byIssue = registerIndex(
            new KeywordIndex<>(DebuggingSession::getIssue));

    public DebuggingStore() {
        super("debugging");
    }

    public synchronized List<DebuggingSession> getByApproach(String approachName) {
        return resolve(byApproach.idsFor(approachName));
    }

    public synchronized List<DebuggingSession> searchByIssue(String keywords) {
        return resolve(byIssue.search(keywords));
    }

    public List<DebuggingSession> getResolved() {
        return filter(DebuggingSession::isResolved);
    }

    /**
     * Approach with the highest share of resolved sessions. Empty when no
     * session has been resolved yet.
     */
    public synchronized Optional<ApproachRate> getMostEffectiveApproach() {
        ApproachRate best = null;
        for (String approach : byApproach.keys()) {
            List<DebuggingSession> sessions = getByApproach(approach);
            long resolved = sessions.stream().filter(DebuggingSession::isResolved).count();
            double rate = sessions.isEmpty() ? 0 : (double) resolved / sessions.size();
            if (rate > 0 && (best == null || rate > best.successRate())) {
                best = new ApproachRate(approach, rate);
            }
        }
        return Optional.ofNullable(best);
    }

    public synchronized Statistics getStatistics() {
        int total = size();
        int resolved = getResolved().size();
        double successRate = total > 0 ? (double) resolved / total : 0;
        return new Statistics(total, resolved, successRate, byApproach.counts());
    }

    public record ApproachRate(String approach, double successRate) {
    }

    public record Statistics(int totalSessions, int resolvedSessions, double successRate,
            Map<String, Integer> approachUsage) {
    }
}
