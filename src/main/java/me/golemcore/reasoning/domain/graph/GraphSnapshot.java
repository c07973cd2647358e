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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a {@link KnowledgeGraph}. Only the node and edge records,
 * the root, clusters and gaps are authoritative on restore; adjacency, levels
 * and the other metrics are rebuilt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSnapshot {

    private String graphId;
    private DeploymentMode mode;
    private String rootId;

    @Builder.Default
    private List<KnowledgeNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<KnowledgeEdge> edges = new ArrayList<>();

    @Builder.Default
    private Map<Integer, List<String>> levels = new LinkedHashMap<>();

    @Builder.Default
    private List<Cluster> clusters = new ArrayList<>();

    private GraphMetrics metrics;
}
