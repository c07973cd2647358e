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

import java.util.ArrayList;
import java.util.List;

/**
 * One application of a debugging approach to an issue. A session counts as
 * resolved once its resolution text is non-blank.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebuggingSession implements ReasoningArtifact {

    private String approachName;
    private String issue;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    private String findings;
    private String resolution;

    @JsonIgnore
    public boolean isResolved() {
        return resolution != null && !resolution.isBlank();
    }
}
