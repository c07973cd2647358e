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

import java.time.Duration;

/**
 * Sandboxed code ran past its wall-clock deadline and was aborted.
 */
public class ExecutionTimeoutException extends ExecutionFailureException {

    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public ExecutionTimeoutException(Duration timeout) {
        super("Execution timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
