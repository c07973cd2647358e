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

import java.util.Arrays;
import java.util.Optional;

/**
 * Tag of the artifact union. Each kind knows its wire name (used by the
 * unified log), its export tag, the store name accepted by session export, the
 * tool name reported in statistics, and the record class it holds.
 */
public enum ArtifactKind {

    THOUGHT("thought", "sequential", "thoughts", "sequential-thinking", "thought", ThoughtData.class),
    MENTAL_MODEL("mental_model", "mental-model", "mentalModels", "mental-models", "model",
            MentalModelApplication.class),
    DEBUGGING("debugging", "debugging", "debugging", "debugging", "debug", DebuggingSession.class),
    COLLABORATIVE("collaborative", "collaborative", "collaborative", "collaborative-reasoning", "collab",
            CollaborativeSession.class),
    DECISION("decision", "decision", "decisions", "decision-framework", "decision", Decision.class),
    METACOGNITIVE("metacognitive", "metacognitive", "metacognitive", "metacognitive-monitoring", "meta",
            MetacognitiveAssessment.class),
    SCIENTIFIC("scientific", "scientific", "scientific", "scientific-method", "sci", ScientificInquiry.class),
    CREATIVE("creative", "creative", "creative", "creative-thinking", "creative", CreativeSession.class),
    SYSTEMS("systems", "systems", "systems", "systems-thinking", "systems", SystemsAnalysis.class),
    VISUAL("visual", "visual", "visual", "visual-reasoning", "visual", VisualOperation.class),
    ARGUMENT("argument", "argument", "argument", "argumentation", "argument", Argument.class);

    private final String wireName;
    private final String exportTag;
    private final String storeName;
    private final String toolName;
    private final String idPrefix;
    private final Class<? extends ReasoningArtifact> artifactClass;

    ArtifactKind(String wireName, String exportTag, String storeName, String toolName, String idPrefix,
            Class<? extends ReasoningArtifact> artifactClass) {
        this.wireName = wireName;
        this.exportTag = exportTag;
        this.storeName = storeName;
        this.toolName = toolName;
        this.idPrefix = idPrefix;
        this.artifactClass = artifactClass;
    }

    public String getWireName() {
        return wireName;
    }

    public String getExportTag() {
        return exportTag;
    }

    public String getStoreName() {
        return storeName;
    }

    public String getToolName() {
        return toolName;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public Class<? extends ReasoningArtifact> getArtifactClass() {
        return artifactClass;
    }

    public static Optional<ArtifactKind> fromWireName(String name) {
        return Arrays.stream(values()).filter(k -> k.wireName.equals(name)).findFirst();
    }

    public static Optional<ArtifactKind> fromExportTag(String tag) {
        return Arrays.stream(values()).filter(k -> k.exportTag.equals(tag)).findFirst();
    }

    public static Optional<ArtifactKind> fromStoreName(String name) {
        return Arrays.stream(values()).filter(k -> k.storeName.equals(name)).findFirst();
    }

    /**
     * Returns the kind of the given artifact instance.
     */
    public static ArtifactKind of(ReasoningArtifact artifact) {
        return Arrays.stream(values())
                .filter(k -> k.artifactClass.isInstance(artifact))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown artifact type: " + artifact.getClass().getName()));
    }
}
