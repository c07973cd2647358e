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

package me.golemcore.reasoning.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One operation on a diagram. Replaying the create, update and delete
 * operations of a diagram in order yields its current element set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualOperation implements ReasoningArtifact {

    private String diagramId;
    private String diagramType;
    private String operation;

    @Builder.Default
    private List<Element> elements = new ArrayList<>();

    private String transformationType;
    private String hypothesis;
    private String observation;
    private String insight;
    private int iteration;
    private boolean nextOperationNeeded;

    @Override
    public String correlationKey() {
        return diagramId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Element {
        private String id;
        private String type;
        private String label;

        @Builder.Default
        private Map<String, Object> properties = new HashMap<>();
    }
}
