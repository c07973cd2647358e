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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A node of the knowledge graph. Instances handed out by
 * {@link KnowledgeGraph} are copies; mutate through the graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeNode {

    private String id;
    private String content;

    @Builder.Default
    private NodeType type = NodeType.SUBJECT;

    private int depth;
    private String parentId;

    @Builder.Default
    private Set<String> childIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> incomingEdges = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> outgoingEdges = new LinkedHashSet<>();

    private double confidence;
    private double centrality;

    @Builder.Default
    private Map<String, Double> passScores = new LinkedHashMap<>();

    private String createdInPass;
    private Instant lastModified;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private String patternUsed;
    private boolean selected;
    private NodeArtifacts artifacts;

    KnowledgeNode copy() {
        return toBuilder()
                .childIds(new LinkedHashSet<>(childIds))
                .incomingEdges(new LinkedHashSet<>(incomingEdges))
                .outgoingEdges(new LinkedHashSet<>(outgoingEdges))
                .passScores(new LinkedHashMap<>(passScores))
                .tags(new LinkedHashSet<>(tags))
                .artifacts(artifacts == null ? null : artifacts.copy())
                .build();
    }
}
