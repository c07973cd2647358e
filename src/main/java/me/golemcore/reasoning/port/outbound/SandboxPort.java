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

package me.golemcore.reasoning.port.outbound;

import me.golemcore.reasoning.domain.notebook.CellOutput;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for evaluating untrusted JavaScript in an isolated sandbox.
 *
 * <p>
 * The sandbox exposes only the ECMAScript built-ins and a {@code console}
 * object: no host classes, no file or network access, no timers. Console
 * output is captured as {@code stdout}/{@code stderr} records and a
 * non-undefined final value as a {@code result} record, until the cumulative
 * output ceiling is reached.
 */
public interface SandboxPort {

    /**
     * Evaluates {@code source}.
     *
     * @param source
     *            script text
     * @param timeout
     *            hard deadline; the guest is aborted once it passes
     * @param maxOutputChars
     *            cumulative output ceiling; records beyond it are dropped
     * @return a future completing with the captured outputs, or with a failed
     *         result when the script throws. It completes exceptionally with
     *         {@link me.golemcore.reasoning.domain.exception.ExecutionTimeoutException}
     *         when the deadline passes.
     */
    CompletableFuture<SandboxResult> execute(String source, Duration timeout, int maxOutputChars);

    /**
     * Outcome of one evaluation.
     *
     * @param outputs
     *            captured records, in emission order
     * @param error
     *            message of the error the script threw, or {@code null}
     */
    record SandboxResult(List<CellOutput> outputs, String error) {

        public static SandboxResult completed(List<CellOutput> outputs) {
            return new SandboxResult(List.copyOf(outputs), null);
        }

        public static SandboxResult failed(List<CellOutput> outputs, String error) {
            return new SandboxResult(List.copyOf(outputs), error);
        }

        public boolean isFailed() {
            return error != null;
        }
    }
}
