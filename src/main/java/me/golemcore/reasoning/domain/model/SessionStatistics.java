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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time summary of a reasoning session: per-store counts, the tools
 * that produced artifacts, and remaining thought capacity.
 */
@Data
@Builder
public class SessionStatistics {

    private String sessionId;
    private Instant createdAt;
    private Instant lastAccessedAt;
    private int thoughtCount;
    private List<String> toolsUsed;
    private int totalOperations;
    private boolean active;
    private int remainingThoughts;
    private Map<String, Integer> stores;
}
