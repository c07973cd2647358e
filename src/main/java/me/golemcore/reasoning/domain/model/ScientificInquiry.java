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
 * One stage of a scientific-method inquiry. The inquiry id ties the stages
 * together; hypotheses and experiments are indexed by their own ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScientificInquiry implements ReasoningArtifact {

    private String inquiryId;
    private String stage;
    private String question;
    private Hypothesis hypothesis;
    private Experiment experiment;
    private String conclusion;
    private int iteration;
    private boolean nextStageNeeded;

    @Override
    public String correlationKey() {
        return inquiryId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Hypothesis {
        private String hypothesisId;
        private String statement;
        private String status;
        private double confidence;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Experiment {
        private String experimentId;
        private String design;
        private String outcome;

        @Builder.Default
        private List<String> unexpectedObservations = new ArrayList<>();
    }
}
