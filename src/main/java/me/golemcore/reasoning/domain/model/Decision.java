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
import java.util.List;

/**
 * A structured decision analysis round. Successive rounds of the same decision
 * share a decision id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Decision implements ReasoningArtifact {

    private String decisionId;
    private String decisionStatement;
    private String analysisType;
    private String stage;

    @Builder.Default
    private List<Option> options = new ArrayList<>();

    @Builder.Default
    private List<Criterion> criteria = new ArrayList<>();

    private String recommendation;
    private int iteration;
    private boolean nextStageNeeded;

    @Override
    public String correlationKey() {
        return decisionId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Option {
        private String id;
        private String name;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Criterion {
        private String id;
        private String name;
        private double weight;
    }
}
