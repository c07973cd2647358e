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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the reasoning core. Carries a stable
 * {@link ErrorCode} and an optional, immutable context map that helps callers
 * report the failure without parsing the message.
 */
public class ReasoningCoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final transient Map<String, Object> context;

    public ReasoningCoreException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public ReasoningCoreException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public ReasoningCoreException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public ReasoningCoreException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context) + "}";
    }
}
