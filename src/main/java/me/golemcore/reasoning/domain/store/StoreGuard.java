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

/**
 * Admission check and store notification of a {@link TypedStore}. Both calls
 * concern new ids only; {@link #stored} runs once the item is visible to
 * readers.
 *
 * @param <T>
 *            stored item type
 */
public interface StoreGuard<T> {

    StoreGuard<Object> ALLOW_ALL = (id, item, currentSize) -> true;

    /**
     * @param currentSize
     *            number of items before the add
     * @return {@code false} to refuse the item
     */
    boolean admit(String id, T item, int currentSize);

    default void stored(String id, T item) {
    }
}
