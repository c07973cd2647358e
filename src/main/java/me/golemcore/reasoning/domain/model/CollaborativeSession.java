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
 * Multi-persona reasoning about a topic. The session id correlates successive
 * rounds of the same collaboration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollaborativeSession implements ReasoningArtifact {

    private String sessionId;
    private String topic;

    @Builder.Default
    private List<Persona> personas = new ArrayList<>();

    @Builder.Default
    private List<Contribution> contributions = new ArrayList<>();

    private String stage;
    private int iteration;
    private boolean nextContributionNeeded;

    @Override
    public String correlationKey() {
        return sessionId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Persona {
        private String id;
        private String name;

        @Builder.Default
        private List<String> expertise = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Contribution {
        private String personaId;
        private String content;
        private String type;
        private double confidence;
    }
}
