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

import java.util.Objects;

/**
 * One entry of the unified artifact log: the kind tag plus the record itself.
 */
public record TaggedArtifact(ArtifactKind type, ReasoningArtifact data) {

    public TaggedArtifact {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        if (!type.getArtifactClass().isInstance(data)) {
            throw new IllegalArgumentException("Artifact " + data.getClass().getSimpleName()
                    + " does not match kind " + type);
        }
    }

    public static TaggedArtifact of(ReasoningArtifact data) {
        return new TaggedArtifact(ArtifactKind.of(data), data);
    }
}
