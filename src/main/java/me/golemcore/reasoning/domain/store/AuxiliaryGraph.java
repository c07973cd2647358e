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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat projection of the unified artifact log: one node per artifact, one
 * concept node per correlation key, and labelled relations between them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuxiliaryGraph {

    public static final String VERSION = "1";

    @Builder.Default
    private List<Node> nodes = new ArrayList<>();

    @Builder.Default
    private List<Edge> edges = new ArrayList<>();

    @Builder.Default
    private String version = VERSION;

    private Instant updatedAt;

    AuxiliaryGraph copy() {
        return AuxiliaryGraph.builder()
                .nodes(new ArrayList<>(nodes.stream().map(Node::copy).toList()))
                .edges(new ArrayList<>(edges.stream().map(Edge::copy).toList()))
                .version(version)
                .updatedAt(updatedAt)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Node {
        private String id;
        private String type;

        @Builder.Default
        private List<String> labels = new ArrayList<>();

        @Builder.Default
        private Map<String, Object> properties = new LinkedHashMap<>();

        Node copy() {
            return new Node(id, type,
                    labels == null ? new ArrayList<>() : new ArrayList<>(labels),
                    properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties));
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Edge {
        private String id;
        private String from;
        private String to;
        private String relation;

        @Builder.Default
        private Map<String, Object> properties = new LinkedHashMap<>();

        Edge copy() {
            return new Edge(id, from, to, relation,
                    properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties));
        }
    }
}
