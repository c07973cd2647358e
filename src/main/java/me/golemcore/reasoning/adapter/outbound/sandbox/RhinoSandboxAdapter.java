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

package me.golemcore.reasoning.adapter.outbound.sandbox;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.exception.ExecutionFailureException;
import me.golemcore.reasoning.domain.exception.ExecutionTimeoutException;
import me.golemcore.reasoning.domain.notebook.CellOutput;
import me.golemcore.reasoning.port.outbound.SandboxPort;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.NativeJSON;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * {@link SandboxPort} backed by the Mozilla Rhino interpreter.
 *
 * <p>
 * Each evaluation runs on a worker thread in a fresh scope holding only the
 * safe standard objects and a capturing {@code console}. Host classes are
 * hidden by a class shutter that rejects everything. The deadline is enforced
 * twice: the interpreter checks it every few thousand instructions and the
 * host stops waiting once it passes.
 */
@Component
@Slf4j
public class RhinoSandboxAdapter implements SandboxPort {

    private static final String DEADLINE_KEY = "sandbox.deadline";
    private static final int INSTRUCTION_THRESHOLD = 10_000;
    private static final int MAX_STACK_DEPTH = 1_000;

    private final SandboxContextFactory contextFactory = new SandboxContextFactory();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "notebook-sandbox-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Override
    public CompletableFuture<SandboxResult> execute(String source, Duration timeout, int maxOutputChars) {
        CompletableFuture<SandboxResult> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        Future<?> worker = workers.submit(() -> {
            try {
                result.complete(evaluate(source, deadline, maxOutputChars, timeout));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } catch (Error e) {
                log.warn("[Sandbox] Evaluation aborted: {}", e.toString());
                result.completeExceptionally(new ExecutionFailureException("Sandbox evaluation aborted: " + e, e));
            }
        });
        return result
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, error) -> {
                    if (error == null) {
                        return value;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof TimeoutException) {
                        worker.cancel(true);
                        throw new CompletionException(new ExecutionTimeoutException(timeout));
                    }
                    throw error instanceof CompletionException
                            ? (CompletionException) error
                            : new CompletionException(error);
                });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    private SandboxResult evaluate(String source, long deadline, int maxOutputChars, Duration timeout) {
        OutputCollector collector = new OutputCollector(maxOutputChars);
        Context cx = contextFactory.enterContext();
        try {
            cx.putThreadLocal(DEADLINE_KEY, deadline);
            ScriptableObject scope = cx.initSafeStandardObjects();
            installConsole(cx, scope, collector);

            Object value = cx.evaluateString(scope, source, "cell", 1, null);
            if (value != null && value != Undefined.instance) {
                collector.add(CellOutput.result(render(cx, scope, value)));
            }
            return SandboxResult.completed(collector.outputs);
        } catch (DeadlineExceeded e) {
            throw new ExecutionTimeoutException(timeout);
        } catch (RhinoException e) {
            log.debug("[Sandbox] Script failed: {}", e.details());
            return SandboxResult.failed(collector.outputs, e.details());
        } catch (StackOverflowError e) {
            // deeply nested values overflow the host stack in JSON.stringify
            log.debug("[Sandbox] Script overflowed the stack");
            return SandboxResult.failed(collector.outputs, "InternalError: too much recursion");
        } finally {
            Context.exit();
        }
    }

    private static void installConsole(Context cx, ScriptableObject scope, OutputCollector collector) {
        Scriptable console = cx.newObject(scope);
        Scriptable functionPrototype = ScriptableObject.getFunctionPrototype(scope);
        for (String name : List.of("log", "info", "debug")) {
            ScriptableObject.putProperty(console, name,
                    new ConsoleFunction(scope, functionPrototype, collector, CellOutput::stdout));
        }
        for (String name : List.of("error", "warn")) {
            ScriptableObject.putProperty(console, name,
                    new ConsoleFunction(scope, functionPrototype, collector, CellOutput::stderr));
        }
        ScriptableObject.putProperty(scope, "console", console);
    }

    static String render(Context cx, Scriptable scope, Object value) {
        if (value instanceof Scriptable && !(value instanceof BaseFunction)) {
            Object json = NativeJSON.stringify(cx, scope, value, null, 2);
            if (json instanceof CharSequence) {
                return json.toString();
            }
        }
        return Context.toString(value);
    }

    private static final class OutputCollector {

        private final int maxChars;
        private final List<CellOutput> outputs = new ArrayList<>();
        private int usedChars;

        private OutputCollector(int maxChars) {
            this.maxChars = maxChars;
        }

        private void add(CellOutput output) {
            int length = output.data().length();
            if (usedChars + length > maxChars) {
                return;
            }
            usedChars += length;
            outputs.add(output);
        }
    }

    private static final class ConsoleFunction extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient OutputCollector collector;
        private final transient Function<String, CellOutput> recordType;

        private ConsoleFunction(Scriptable scope, Scriptable prototype, OutputCollector collector,
                Function<String, CellOutput> recordType) {
            super(scope, prototype);
            this.collector = collector;
            this.recordType = recordType;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < args.length; i++) {
                if (i > 0) {
                    line.append(' ');
                }
                line.append(render(cx, scope, args[i]));
            }
            collector.add(recordType.apply(line.toString()));
            return Undefined.instance;
        }
    }

    /**
     * Unwinds the interpreter without running guest catch or finally blocks.
     */
    private static final class DeadlineExceeded extends Error {

        private static final long serialVersionUID = 1L;

        private DeadlineExceeded() {
            super("Sandbox deadline exceeded", null, false, false);
        }
    }

    private static final class SandboxContextFactory extends ContextFactory {

        @Override
        protected Context makeContext() {
            Context cx = super.makeContext();
            cx.setLanguageVersion(Context.VERSION_ES6);
            cx.setOptimizationLevel(-1);
            cx.setMaximumInterpreterStackDepth(MAX_STACK_DEPTH);
            cx.setInstructionObserverThreshold(INSTRUCTION_THRESHOLD);
            cx.setClassShutter(className -> false);
            return cx;
        }

        @Override
        protected void observeInstructionCount(Context cx, int instructionCount) {
            Object deadline = cx.getThreadLocal(DEADLINE_KEY);
            if (Thread.currentThread().isInterrupted()
                    || (deadline instanceof Long && System.nanoTime() - (Long) deadline > 0)) {
                throw new DeadlineExceeded();
            }
        }
    }
}
