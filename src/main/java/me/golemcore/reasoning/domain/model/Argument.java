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
 * A structured argument: a claim, its premises and conclusion, and links to the
 * arguments it answers, supports or contradicts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Argument implements ReasoningArtifact {

    private String argumentId;
    private String argumentType;
    private String claim;

    @Builder.Default
    private List<String> premises = new ArrayList<>();

    private String conclusion;
    private double confidence;
    private String respondsTo;

    @Builder.Default
    private List<String> supports = new ArrayList<>();

    @Builder.Default
    private List<String> contradicts = new ArrayList<>();

    private boolean nextArgumentNeeded;
}
