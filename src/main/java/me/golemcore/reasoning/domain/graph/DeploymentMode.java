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

package me.golemcore.reasoning.domain.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Size class of a knowledge graph. The mode is fixed when the graph is created
 * and its ceilings are enforced on every mutation.
 */
public enum DeploymentMode {

    DEVELOPMENT(new ResourceLimits(500, 2_500, 8, 10, null)),
    STANDARD(new ResourceLimits(5_000, 25_000, 10, 50, null)),
    EXTENDED(new ResourceLimits(20_000, 100_000, 12, 200, null)),
    CLOUD(new ResourceLimits(50_000, 250_000, 15, 500, "-Xmx2g"));

    private final ResourceLimits limits;

    DeploymentMode(ResourceLimits limits) {
        this.limits = limits;
    }

    public ResourceLimits getLimits() {
        return limits;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeploymentMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown deployment mode: " + value));
    }

    /**
     * Ceilings of a deployment mode.
     *
     * @param maxNodes
     *            node count ceiling
     * @param maxEdges
     *            edge count ceiling
     * @param maxDepth
     *            deepest allowed hierarchy level
     * @param targetMemoryMb
     *            memory the graph is sized for
     * @param heapHint
     *            JVM option the mode needs, or {@code null}
     */
    public record ResourceLimits(int maxNodes, int maxEdges, int maxDepth, int targetMemoryMb, String heapHint) {

        public boolean requiresHeapHint() {
            return heapHint != null;
        }
    }
}
