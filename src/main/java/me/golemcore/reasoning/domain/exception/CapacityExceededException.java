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

package me.golemcore.reasoning.domain.exception;

import java.util.Map;

/**
 * Raised when a mutation would push a bounded collection past its ceiling.
 */
public class CapacityExceededException extends ReasoningCoreException {

    private static final long serialVersionUID = 1L;

    public CapacityExceededException(String resource, int limit, String message) {
        super(ErrorCode.CAPACITY_EXCEEDED, message, Map.of("resource", resource, "limit", limit));
    }

    public String getResource() {
        return (String) getContext().get("resource");
    }

    public int getLimit() {
        return (Integer) getContext().get("limit");
    }
}
