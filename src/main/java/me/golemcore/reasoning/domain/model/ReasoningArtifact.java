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

/**
 * Marker for every record a reasoning session can store. Artifacts that belong
 * to a longer-running exchange (a decision, an inquiry, a diagram) expose the
 * identifier of that exchange as their correlation key.
 */
public interface ReasoningArtifact {

    /**
     * Identifier of the exchange this artifact belongs to, or {@code null} when
     * the artifact stands alone.
     */
    default String correlationKey() {
        return null;
    }
}
