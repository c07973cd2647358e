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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Keyed container for one artifact type. Items are kept in insertion order;
 * re-adding an existing id replaces the item in place.
 *
 * <p>
 * Secondary indices are registered as {@link StoreIndex} components and are
 * updated under the same lock as the primary map, so a reader never observes
 * an index that disagrees with the map. Every read returns a copy, which lets a
 * background cleanup clear the store while a caller iterates an earlier result.
 *
 * <p>
 * No operation throws for a missing id; {@link #update} reports it by
 * returning {@code false}.
 *
 * @param <T>
 *            stored item type
 */
@Slf4j
public class TypedStore<T> {

    private final String storeName;
    private final Map<String, T> data = new LinkedHashMap<>();
    private final List<StoreIndex<T>> indices = new ArrayList<>();
    private StoreGuard<? super T> guard = StoreGuard.ALLOW_ALL;

    public TypedStore(String storeName) {
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }

    protected final synchronized <I extends StoreIndex<T>> I registerIndex(I index) {
        data.forEach(index::add);
        indices.add(index);
        return index;
    }

    /**
     * Installs the guard consulted before a new id is stored. Replacing an
     * existing id is always allowed.
     */
    public synchronized void setGuard(StoreGuard<? super T> guard) {
        this.guard = guard == null ? StoreGuard.ALLOW_ALL : guard;
    }

    /**
     * Stores the item, replacing any item under the same id.
     *
     * @return {@code false} if the guard refused a new id
     */
    public boolean add(String id, T item) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(item, "item");
        StoreGuard<? super T> admittedBy;
        synchronized (this) {
            if (data.containsKey(id)) {
                put(id, item);
                return true;
            }
            if (!guard.admit(id, item, data.size())) {
                return false;
            }
            put(id, item);
            admittedBy = guard;
        }
        admittedBy.stored(id, item);
        return true;
    }

    private void put(String id, T item) {
        T previous = data.put(id, item);
        if (previous != null) {
            for (StoreIndex<T> index : indices) {
                index.remove(id, previous);
            }
        }
        for (StoreIndex<T> index : indices) {
            index.add(id, item);
        }
    }

    public synchronized List<T> getAll() {
        return new ArrayList<>(data.values());
    }

    public synchronized Optional<T> get(String id) {
        return Optional.ofNullable(data.get(id));
    }

    public synchronized boolean has(String id) {
        return data.containsKey(id);
    }

    public synchronized boolean delete(String id) {
        T removed = data.remove(id);
        if (removed == null) {
            return false;
        }
        for (StoreIndex<T> index : indices) {
            index.remove(id, removed);
        }
        return true;
    }

    public synchronized int size() {
        return data.size();
    }

    public synchronized void clear() {
        data.clear();
        for (StoreIndex<T> index : indices) {
            index.clear();
        }
    }

    public synchronized List<String> keys() {
        return new ArrayList<>(data.keySet());
    }

    public List<T> values() {
        return getAll();
    }

    /**
     * Iterates a snapshot of the entries, so the callback may mutate the store.
     */
    public void forEach(BiConsumer<String, T> action) {
        for (Map.Entry<String, T> entry : exportData().entrySet()) {
            action.accept(entry.getKey(), entry.getValue());
        }
    }

    public List<T> filter(Predicate<? super T> predicate) {
        return getAll().stream().filter(predicate).toList();
    }

    public Optional<T> find(Predicate<? super T> predicate) {
        return getAll().stream().filter(predicate).findFirst();
    }

    /**
     * Replaces the item under {@code id} with the updater's result.
     *
     * @return {@code false} if no item is stored under {@code id}
     */
    public synchronized boolean update(String id, UnaryOperator<T> updater) {
        T current = data.get(id);
        if (current == null) {
            return false;
        }
        put(id, Objects.requireNonNull(updater.apply(current), "item"));
        return true;
    }

    public synchronized Map<String, T> exportData() {
        return new LinkedHashMap<>(data);
    }

    /**
     * Replaces the whole content of the store, rebuilding every index. Items
     * pass through the guard like any other add.
     */
    public synchronized void importData(Map<String, ? extends T> imported) {
        clear();
        imported.forEach(this::add);
        log.debug("[Store] {} imported {} items", storeName, imported.size());
    }

    protected synchronized List<T> resolve(Collection<String> ids) {
        List<T> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            T item = data.get(id);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }
}
