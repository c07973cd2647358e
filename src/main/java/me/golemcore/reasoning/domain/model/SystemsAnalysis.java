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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemsAnalysis implements ReasoningArtifact {

    private String system;

    @Builder.Default
    private List<String> components = new ArrayList<>();

    @Builder.Default
    private List<String> relationships = new ArrayList<>();

    @Builder.Default
    private List<String> feedbackLoops = new ArrayList<>();

    @Builder.Default
    private List<String> emergentProperties = new ArrayList<>();

    @Builder.Default
    private List<String> leveragePoints = new ArrayList<>();

    private int iteration;
    private boolean nextAnalysisNeeded;
}
