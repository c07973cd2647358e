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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Exported form of a single session artifact. The session type is the export
 * tag of the artifact kind, which selects the add operation replayed on import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionExport {

    public static final String FORMAT_VERSION = "1.0.0";

    @Builder.Default
    private String version = FORMAT_VERSION;

    private Instant timestamp;
    private String sessionId;
    private String sessionType;
    private Object data;

    @JsonIgnore
    public Optional<ArtifactKind> getKind() {
        return ArtifactKind.fromExportTag(sessionType);
    }
}
