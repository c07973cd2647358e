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

/**
 * A typed, weighted edge between two knowledge nodes. A bidirectional edge is
 * registered as outgoing and incoming on both endpoints.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeEdge {

    private String id;
    private String sourceId;
    private String targetId;

    @Builder.Default
    private RelationType relation = RelationType.RELATES_TO;

    private double weight;
    private double confidence;
    private String createdInPass;
    private String justification;
    private boolean bidirectional;

    KnowledgeEdge copy() {
        return toBuilder().build();
    }
}
