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

import java.util.List;
import java.util.Map;

/**
 * Partial update of a knowledge node; null fields are left unchanged. Pass
 * scores and artifacts are merged into the existing values, tags replace them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeUpdate {

    private String content;
    private NodeType type;
    private Double confidence;
    private Double centrality;
    private Map<String, Double> passScores;
    private String createdInPass;
    private List<String> tags;
    private String patternUsed;
    private Boolean selected;
    private NodeArtifacts artifacts;
}
