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
 * Input of {@link KnowledgeGraph#addEdge}. A null weight or confidence means
 * 0.5; a null relation means {@code relates-to}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeDraft {

    private String sourceId;
    private String targetId;
    private RelationType relation;
    private Double weight;
    private Double confidence;
    private String createdInPass;
    private String justification;
    private boolean bidirectional;
}
