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

package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.VisualOperation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagram operations indexed by diagram id and diagram type.
 *
 * <p>
 * The current element set of a diagram is not stored; it is replayed from the
 * diagram's operations in insertion order. {@code create} and {@code add}
 * append elements, {@code update} replaces elements by id and appends unknown
 * ones, {@code transform} only replaces known ones, and {@code delete} and
 * {@code remove} drop elements by id.
 */
public class VisualStore extends TypedStore<VisualOperation> {

    private final KeyedIndex<VisualOperation> byDiagram = registerIndex(
            KeyedIndex.single(VisualOperation::getDiagramId));
    private final KeyedIndex<VisualOperation> byDiagramType = registerIndex(
            KeyedIndex.single(VisualOperation::getDiagramType));

    public VisualStore() {
        super("visual");
    }

    public synchronized List<VisualOperation> getByDiagram(String diagramId) {
        return resolve(byDiagram.idsFor(diagramId));
    }

    /**
     * Distinct diagram ids that have at least one operation of the given type.
     */
    public synchronized List<String> getDiagramsByType(String diagramType) {
        Set<String> diagramIds = new LinkedHashSet<>();
        for (VisualOperation operation : resolve(byDiagramType.idsFor(diagramType))) {
            if (operation.getDiagramId() != null) {
                diagramIds.add(operation.getDiagramId());
            }
        }
        return new ArrayList<>(diagramIds);
    }

    public List<VisualOperation> getByOperation(String operation) {
        return filter(v -> operation.equals(v.getOperation()));
    }

    public List<VisualOperation> getActive() {
        return filter(VisualOperation::isNextOperationNeeded);
    }

    public List<VisualOperation.Element> getDiagramState(String diagramId) {
        List<VisualOperation.Element> state = new ArrayList<>();
        for (VisualOperation operation : getByDiagram(diagramId)) {
            List<VisualOperation.Element> elements = operation.getElements();
            if (elements == null || operation.getOperation() == null) {
                continue;
            }
            switch (operation.getOperation()) {
            case "create", "add" -> state.addAll(elements);
            case "update" -> elements.forEach(e -> replace(state, e, true));
            case "transform" -> elements.forEach(e -> replace(state, e, false));
            case "delete", "remove" -> {
                Set<String> removed = new LinkedHashSet<>();
                elements.forEach(e -> removed.add(e.getId()));
                state.removeIf(e -> removed.contains(e.getId()));
            }
            default -> {
                // observation-only operations leave the element set unchanged
            }
            }
        }
        return state;
    }

    private static void replace(List<VisualOperation.Element> state, VisualOperation.Element element,
            boolean appendUnknown) {
        for (int i = 0; i < state.size(); i++) {
            if (element.getId() != null && element.getId().equals(state.get(i).getId())) {
                state.set(i, element);
                return;
            }
        }
        if (appendUnknown) {
            state.add(element);
        }
    }

    public Map<String, Integer> getOperationDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (VisualOperation operation : getAll()) {
            if (operation.getOperation() != null) {
                distribution.merge(operation.getOperation(), 1, Integer::sum);
            }
        }
        return distribution;
    }

    public synchronized Statistics getStatistics() {
        Map<String, Integer> diagramTypes = new LinkedHashMap<>();
        for (String type : byDiagramType.keys()) {
            diagramTypes.put(type, getDiagramsByType(type).size());
        }
        return new Statistics(size(), byDiagram.keys().size(), diagramTypes, getOperationDistribution());
    }

    public record Statistics(int totalOperations, int diagrams, Map<String, Integer> diagramTypes,
            Map<String, Integer> operations) {
    }
}
