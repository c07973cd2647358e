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

package me.golemcore.reasoning.domain.notebook;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ephemeral notebook bound to one reasoning session. Instances returned by
 * {@link NotebookStore} are snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notebook {

    private String id;
    private String sessionId;
    private Instant createdAt;
    private Instant lastAccessedAt;

    @Builder.Default
    private List<Cell> cells = new ArrayList<>();

    @Builder.Default
    private Map<String, Execution> executions = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Optional<Cell> findCell(String cellId) {
        return cells.stream().filter(c -> c.getId().equals(cellId)).findFirst();
    }

    Notebook copy() {
        Map<String, Execution> executionCopies = new LinkedHashMap<>();
        executions.forEach((id, execution) -> executionCopies.put(id, execution.copy()));
        return toBuilder()
                .cells(new ArrayList<>(cells.stream().map(Cell::copy).toList()))
                .executions(executionCopies)
                .metadata(new LinkedHashMap<>(metadata))
                .build();
    }
}
