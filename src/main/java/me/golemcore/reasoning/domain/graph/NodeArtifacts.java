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
import java.util.List;

/**
 * Supporting material attached to a knowledge node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NodeArtifacts {

    private String reasoning;

    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    @Builder.Default
    private List<String> citations = new ArrayList<>();

    NodeArtifacts copy() {
        return toBuilder()
                .evidence(evidence == null ? new ArrayList<>() : new ArrayList<>(evidence))
                .citations(citations == null ? new ArrayList<>() : new ArrayList<>(citations))
                .build();
    }

    /**
     * Overlays the non-null fields of {@code other} onto a copy of this.
     */
    NodeArtifacts merge(NodeArtifacts other) {
        NodeArtifacts merged = copy();
        if (other.getReasoning() != null) {
            merged.setReasoning(other.getReasoning());
        }
        if (other.getEvidence() != null && !other.getEvidence().isEmpty()) {
            merged.setEvidence(new ArrayList<>(other.getEvidence()));
        }
        if (other.getCitations() != null && !other.getCitations().isEmpty()) {
            merged.setCitations(new ArrayList<>(other.getCitations()));
        }
        return merged;
    }
}
