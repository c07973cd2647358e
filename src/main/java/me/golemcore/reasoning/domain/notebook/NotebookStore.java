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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.exception.CapacityExceededException;
import me.golemcore.reasoning.domain.exception.ExecutionTimeoutException;
import me.golemcore.reasoning.domain.exception.ReferenceNotFoundException;
import me.golemcore.reasoning.domain.exception.ValidationException;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import me.golemcore.reasoning.port.outbound.SandboxPort;
import me.golemcore.reasoning.port.outbound.SchedulerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Ephemeral notebooks, at most one per reasoning session, with code cells run
 * in the {@link SandboxPort}.
 *
 * <p>
 * A periodic sweep drops notebooks that have not been accessed within the idle
 * TTL. The sweep does not wait for running executions; a late result lands in
 * the detached notebook and is discarded with it.
 *
 * <p>
 * Cell execution outcomes:
 * <ul>
 * <li>completed: cell back to idle, outputs are the captured records</li>
 * <li>script error: execution and cell failed with a single {@code error}
 * record; the returned future still completes normally</li>
 * <li>timeout: execution and cell failed with a single {@code error} record;
 * the future completes exceptionally with {@link ExecutionTimeoutException}</li>
 * </ul>
 */
@Service
@Slf4j
public class NotebookStore {

    static final String DEFAULT_LANGUAGE = "javascript";

    private final ReasoningProperties.NotebookProperties config;
    private final SandboxPort sandbox;
    private final NotebookPresetRegistry presets;
    private final Clock clock;

    private final Map<String, Notebook> notebooks = new LinkedHashMap<>();
    private SchedulerPort.ScheduledTask sweepTask;

    public NotebookStore(ReasoningProperties properties, SandboxPort sandbox, SchedulerPort scheduler,
            NotebookPresetRegistry presets, Clock clock) {
        this.config = properties.getNotebook();
        this.sandbox = sandbox;
        this.presets = presets;
        this.clock = clock;
        this.sweepTask = scheduler.scheduleAtFixedRate(this::sweepIdleNotebooks, config.getSweepInterval());
    }

    /**
     * Returns the notebook of the session, creating it on first call. Reuse
     * counts as access for the idle sweep.
     *
     * @throws ValidationException
     *             if the session id is null or blank
     */
    public synchronized Notebook createNotebook(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("Session id is required");
        }
        Optional<Notebook> existing = findBySession(sessionId);
        if (existing.isPresent()) {
            Notebook notebook = existing.get();
            synchronized (notebook) {
                notebook.setLastAccessedAt(clock.instant());
                return notebook.copy();
            }
        }
        Instant now = clock.instant();
        Notebook notebook = Notebook.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .createdAt(now)
                .lastAccessedAt(now)
                .build();
        notebooks.put(notebook.getId(), notebook);
        log.info("[Notebook] Created notebook {} for session {}", notebook.getId(), sessionId);
        return notebook.copy();
    }

    /**
     * Creates (or reuses) the session notebook and appends the cells of the
     * named preset.
     */
    public Notebook createNotebookFromPreset(String sessionId, String presetKey) {
        NotebookPreset preset = presets.get(presetKey)
                .orElseThrow(() -> new ReferenceNotFoundException("Preset", presetKey));
        Notebook notebook = createNotebook(sessionId);
        for (NotebookPreset.PresetCell cell : preset.getCells()) {
            addCell(notebook.getId(), cell.getKind(), cell.getSource(), cell.getLanguage(), null);
        }
        Notebook stored = requireNotebook(notebook.getId());
        synchronized (stored) {
            stored.getMetadata().put("preset", presetKey);
            return stored.copy();
        }
    }

    public List<NotebookPreset> listPresets() {
        return presets.list();
    }

    public Optional<Notebook> getNotebook(String notebookId) {
        Notebook notebook;
        synchronized (this) {
            notebook = notebooks.get(notebookId);
        }
        if (notebook == null) {
            return Optional.empty();
        }
        synchronized (notebook) {
            notebook.setLastAccessedAt(clock.instant());
            return Optional.of(notebook.copy());
        }
    }

    public Optional<Notebook> getNotebookBySession(String sessionId) {
        Optional<Notebook> notebook;
        synchronized (this) {
            notebook = findBySession(sessionId);
        }
        return notebook.flatMap(n -> getNotebook(n.getId()));
    }

    /**
     * Inserts a cell at {@code index} when {@code 0 <= index <= size}, appends
     * it otherwise.
     */
    public Cell addCell(String notebookId, CellKind kind, String source, String language, Integer index) {
        if (kind == null) {
            throw new ValidationException("Cell kind is required");
        }
        Notebook notebook = requireNotebook(notebookId);
        synchronized (notebook) {
            List<Cell> cells = notebook.getCells();
            if (cells.size() >= config.getMaxCells()) {
                throw new CapacityExceededException("cells", config.getMaxCells(),
                        "Maximum number of cells (" + config.getMaxCells() + ") reached");
            }
            boolean code = kind == CellKind.CODE;
            Cell cell = Cell.builder()
                    .id(UUID.randomUUID().toString())
                    .kind(kind)
                    .source(source == null ? "" : source)
                    .language(code ? (language == null ? DEFAULT_LANGUAGE : language) : null)
                    .status(code ? CellStatus.IDLE : null)
                    .build();
            if (index != null && index >= 0 && index <= cells.size()) {
                cells.add(index, cell);
            } else {
                cells.add(cell);
            }
            return cell.copy();
        }
    }

    public Cell updateCell(String notebookId, String cellId, CellUpdate update) {
        Notebook notebook = requireNotebook(notebookId);
        synchronized (notebook) {
            Cell cell = requireCell(notebook, cellId);
            if (update.getSource() != null) {
                cell.setSource(update.getSource());
            }
            if (update.getLanguage() != null && cell.getKind() == CellKind.CODE) {
                cell.setLanguage(update.getLanguage());
            }
            if (update.getMetadata() != null) {
                cell.getMetadata().putAll(update.getMetadata());
            }
            return cell.copy();
        }
    }

    /**
     * @return {@code false} if the notebook has no such cell
     */
    public boolean deleteCell(String notebookId, String cellId) {
        Notebook notebook = requireNotebook(notebookId);
        synchronized (notebook) {
            return notebook.getCells().removeIf(c -> c.getId().equals(cellId));
        }
    }

    /**
     * Runs a code cell. A null timeout means the configured default; longer
     * timeouts are capped at the configured maximum.
     */
    public CompletableFuture<Execution> executeCell(String notebookId, String cellId, Duration timeout) {
        Notebook notebook = requireNotebook(notebookId);
        Duration effectiveTimeout = effectiveTimeout(timeout);
        Execution execution;
        String source;
        synchronized (notebook) {
            Cell cell = requireCell(notebook, cellId);
            if (cell.getKind() != CellKind.CODE) {
                throw new ValidationException("Cell " + cellId + " is not a code cell");
            }
            if (cell.getStatus() == CellStatus.RUNNING) {
                throw new ValidationException("Cell " + cellId + " is already running");
            }
            if (notebook.getExecutions().size() >= config.getMaxExecutions()) {
                throw new CapacityExceededException("executions", config.getMaxExecutions(),
                        "Maximum number of executions (" + config.getMaxExecutions() + ") reached");
            }
            execution = Execution.builder()
                    .id(UUID.randomUUID().toString())
                    .cellId(cellId)
                    .status(ExecutionStatus.RUNNING)
                    .startedAt(clock.instant())
                    .build();
            notebook.getExecutions().put(execution.getId(), execution);
            cell.setStatus(CellStatus.RUNNING);
            cell.setOutputs(new ArrayList<>());
            source = cell.getSource();
        }
        log.debug("[Notebook] Executing cell {} of notebook {} (timeout {})", cellId, notebookId, effectiveTimeout);

        CompletableFuture<SandboxPort.SandboxResult> run;
        try {
            run = sandbox.execute(source, effectiveTimeout, config.getMaxOutputBytesPerExec());
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }
        return run.handle((result, error) -> complete(notebook, cellId, execution, result, error));
    }

    public String exportToMarkdown(String notebookId) {
        Notebook notebook = requireNotebook(notebookId);
        StringBuilder md = new StringBuilder();
        synchronized (notebook) {
            for (Cell cell : notebook.getCells()) {
                if (cell.getKind() == CellKind.MARKDOWN) {
                    md.append(cell.getSource()).append("\n\n");
                    continue;
                }
                md.append("```").append(cell.getLanguage() == null ? DEFAULT_LANGUAGE : cell.getLanguage())
                        .append('\n');
                md.append(cell.getSource()).append('\n');
                md.append("```\n");
                if (!cell.getOutputs().isEmpty()) {
                    md.append("\n**Output:**\n```\n");
                    for (CellOutput output : cell.getOutputs()) {
                        switch (output.type()) {
                        case STDOUT -> md.append(output.data()).append('\n');
                        case STDERR, ERROR -> md.append("Error: ").append(output.data()).append('\n');
                        case RESULT -> md.append("Result: ").append(output.data()).append('\n');
                        }
                    }
                    md.append("```\n\n");
                }
            }
        }
        return md.toString();
    }

    public NotebookExport exportToJson(String notebookId) {
        Notebook notebook = requireNotebook(notebookId);
        synchronized (notebook) {
            Notebook snapshot = notebook.copy();
            return NotebookExport.builder()
                    .id(snapshot.getId())
                    .sessionId(snapshot.getSessionId())
                    .createdAt(snapshot.getCreatedAt())
                    .cells(snapshot.getCells())
                    .executions(new ArrayList<>(snapshot.getExecutions().values()))
                    .build();
        }
    }

    public synchronized boolean deleteNotebook(String notebookId) {
        return notebooks.remove(notebookId) != null;
    }

    public synchronized int size() {
        return notebooks.size();
    }

    /**
     * Stops the idle sweep and drops every notebook.
     */
    @PreDestroy
    public synchronized void cleanup() {
        if (sweepTask != null) {
            sweepTask.cancel();
            sweepTask = null;
        }
        notebooks.clear();
    }

    synchronized void sweepIdleNotebooks() {
        Instant cutoff = clock.instant().minus(config.getIdleTtl());
        int removed = 0;
        Iterator<Notebook> iterator = notebooks.values().iterator();
        while (iterator.hasNext()) {
            Notebook notebook = iterator.next();
            Instant lastAccessed;
            synchronized (notebook) {
                lastAccessed = notebook.getLastAccessedAt();
            }
            if (lastAccessed.isBefore(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("[Notebook] Swept {} idle notebooks", removed);
        }
    }

    private Execution complete(Notebook notebook, String cellId, Execution execution,
            SandboxPort.SandboxResult result, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        synchronized (notebook) {
            Optional<Cell> cell = notebook.findCell(cellId);
            execution.setCompletedAt(clock.instant());
            if (cause == null && !result.isFailed()) {
                execution.setStatus(ExecutionStatus.COMPLETE);
                execution.setOutputs(new ArrayList<>(result.outputs()));
                cell.ifPresent(c -> {
                    c.setStatus(CellStatus.IDLE);
                    c.setOutputs(new ArrayList<>(result.outputs()));
                });
                return execution.copy();
            }
            String message = cause == null ? result.error() : describe(cause);
            execution.setStatus(ExecutionStatus.FAILED);
            execution.setError(message);
            execution.setOutputs(new ArrayList<>(List.of(CellOutput.error(message))));
            cell.ifPresent(c -> {
                c.setStatus(CellStatus.FAILED);
                c.setOutputs(new ArrayList<>(List.of(CellOutput.error(message))));
            });
        }
        if (cause instanceof ExecutionTimeoutException timeout) {
            log.debug("[Notebook] Cell {} timed out", cellId);
            throw new CompletionException(timeout);
        }
        log.debug("[Notebook] Cell {} failed: {}", cellId, execution.getError());
        return execution.copy();
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return config.getDefaultTimeout();
        }
        return requested.compareTo(config.getMaxTimeout()) > 0 ? config.getMaxTimeout() : requested;
    }

    private Notebook requireNotebook(String notebookId) {
        Notebook notebook;
        synchronized (this) {
            notebook = notebooks.get(notebookId);
        }
        if (notebook == null) {
            throw new ReferenceNotFoundException("Notebook", notebookId);
        }
        synchronized (notebook) {
            notebook.setLastAccessedAt(clock.instant());
        }
        return notebook;
    }

    private static Cell requireCell(Notebook notebook, String cellId) {
        return notebook.findCell(cellId).orElseThrow(() -> new ReferenceNotFoundException("Cell", cellId));
    }

    private Optional<Notebook> findBySession(String sessionId) {
        return notebooks.values().stream().filter(n -> n.getSessionId().equals(sessionId)).findFirst();
    }
}
