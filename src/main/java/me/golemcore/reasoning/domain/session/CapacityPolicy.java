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

package me.golemcore.reasoning.domain.session;

import me.golemcore.reasoning.domain.model.ArtifactKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-kind ceiling on the number of artifacts one session may hold. A limit of
 * zero or below means unbounded.
 */
public final class CapacityPolicy {

    public static final int UNBOUNDED = 0;

    private final Map<ArtifactKind, Integer> limits;

    private CapacityPolicy(Map<ArtifactKind, Integer> limits) {
        this.limits = Collections.unmodifiableMap(limits);
    }

    public static CapacityPolicy unbounded() {
        return new CapacityPolicy(new EnumMap<>(ArtifactKind.class));
    }

    /**
     * Builds a policy from configured per-kind limits, with the thought ceiling
     * taken from {@code maxThoughts}.
     */
    public static CapacityPolicy of(int maxThoughts, Map<ArtifactKind, Integer> configured) {
        Map<ArtifactKind, Integer> limits = new EnumMap<>(ArtifactKind.class);
        if (configured != null) {
            limits.putAll(configured);
        }
        limits.put(ArtifactKind.THOUGHT, maxThoughts);
        return new CapacityPolicy(limits);
    }

    public CapacityPolicy withLimit(ArtifactKind kind, int limit) {
        Map<ArtifactKind, Integer> copy = new EnumMap<>(ArtifactKind.class);
        copy.putAll(limits);
        copy.put(kind, limit);
        return new CapacityPolicy(copy);
    }

    public int limitFor(ArtifactKind kind) {
        Integer limit = limits.get(kind);
        return limit == null || limit <= 0 ? UNBOUNDED : limit;
    }

    public boolean isBounded(ArtifactKind kind) {
        return limitFor(kind) != UNBOUNDED;
    }

    /**
     * Remaining room given the current count, or {@link Integer#MAX_VALUE} when
     * the kind is unbounded.
     */
    public int remaining(ArtifactKind kind, int currentCount) {
        if (!isBounded(kind)) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, limitFor(kind) - currentCount);
    }
}
