package me.golemcore.reasoning.domain.notebook;

import me.golemcore.reasoning.domain.exception.CapacityExceededException;
import me.golemcore.reasoning.domain.exception.ExecutionTimeoutException;
import me.golemcore.reasoning.domain.exception.ReferenceNotFoundException;
import me.golemcore.reasoning.domain.exception.ValidationException;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import me.golemcore.reasoning.port.outbound.SandboxPort;
import me.golemcore.reasoning.testsupport.ManualScheduler;
import me.golemcore.reasoning.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotebookStoreTest {

    private static final String SESSION_ID = "session-1";

    private ReasoningProperties properties;
    private SandboxPort sandbox;
    private ManualScheduler scheduler;
    private MutableClock clock;
    private NotebookPresetRegistry presets;
    private NotebookStore store;

    @BeforeEach
    void setUp() {
        properties = new ReasoningProperties();
        sandbox = mock(SandboxPort.class);
        scheduler = new ManualScheduler();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        presets = mock(NotebookPresetRegistry.class);
        store = new NotebookStore(properties, sandbox, scheduler, presets, clock);
    }

    @Test
    void shouldCreateOneNotebookPerSession() {
        Notebook first = store.createNotebook(SESSION_ID);
        Notebook second = store.createNotebook(SESSION_ID);

        assertEquals(first.getId(), second.getId());
        assertEquals(1, store.size());
        assertEquals(first.getId(), store.getNotebookBySession(SESSION_ID).orElseThrow().getId());
    }

    @Test
    void shouldInsertCellsAtIndexOrAppend() {
        String id = store.createNotebook(SESSION_ID).getId();
        Cell a = store.addCell(id, CellKind.CODE, "1", null, null);
        Cell b = store.addCell(id, CellKind.MARKDOWN, "# b", null, 0);
        Cell c = store.addCell(id, CellKind.CODE, "3", "typescript", 99);

        List<Cell> cells = store.getNotebook(id).orElseThrow().getCells();

        assertEquals(List.of(b.getId(), a.getId(), c.getId()), cells.stream().map(Cell::getId).toList());
        assertEquals("javascript", a.getLanguage());
        assertEquals(CellStatus.IDLE, a.getStatus());
        assertNull(b.getLanguage());
        assertNull(b.getStatus());
        assertEquals("typescript", c.getLanguage());
    }

    @Test
    void shouldRejectCellsBeyondCeiling() {
        properties.getNotebook().setMaxCells(2);
        String id = store.createNotebook(SESSION_ID).getId();
        store.addCell(id, CellKind.CODE, "1", null, null);
        store.addCell(id, CellKind.CODE, "2", null, null);

        assertThrows(CapacityExceededException.class, () -> store.addCell(id, CellKind.CODE, "3", null, null));
    }

    @Test
    void shouldUpdateAndDeleteCells() {
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "1", null, null);

        Cell updated = store.updateCell(id, cell.getId(),
                CellUpdate.builder().source("2").metadata(Map.of("tag", "x")).build());

        assertEquals("2", updated.getSource());
        assertEquals("javascript", updated.getLanguage());
        assertEquals("x", updated.getMetadata().get("tag"));
        assertThrows(ReferenceNotFoundException.class,
                () -> store.updateCell(id, "missing", CellUpdate.builder().source("x").build()));
        assertTrue(store.deleteCell(id, cell.getId()));
        assertFalse(store.deleteCell(id, cell.getId()));
        assertThrows(ReferenceNotFoundException.class, () -> store.deleteCell("missing", cell.getId()));
    }

    @Test
    void shouldRecordSuccessfulExecution() {
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(CompletableFuture.completedFuture(
                SandboxPort.SandboxResult.completed(List.of(CellOutput.stdout("hi"), CellOutput.result("42")))));
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "console.log('hi'); 42", null, null);

        Execution execution = store.executeCell(id, cell.getId(), null).join();

        assertEquals(ExecutionStatus.COMPLETE, execution.getStatus());
        assertEquals(2, execution.getOutputs().size());
        Cell after = store.getNotebook(id).orElseThrow().findCell(cell.getId()).orElseThrow();
        assertEquals(CellStatus.IDLE, after.getStatus());
        assertEquals(CellOutput.result("42"), after.getOutputs().get(1));
        verify(sandbox).execute("console.log('hi'); 42", Duration.ofSeconds(5), 262_144);
    }

    @Test
    void shouldKeepSingleErrorRecordWhenScriptThrows() {
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(CompletableFuture.completedFuture(
                SandboxPort.SandboxResult.failed(List.of(CellOutput.stdout("before")), "Error: boom")));
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "throw new Error('boom')", null, null);

        Execution execution = store.executeCell(id, cell.getId(), null).join();

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals("Error: boom", execution.getError());
        assertEquals(List.of(CellOutput.error("Error: boom")), execution.getOutputs());
        Cell after = store.getNotebook(id).orElseThrow().findCell(cell.getId()).orElseThrow();
        assertEquals(CellStatus.FAILED, after.getStatus());
        assertEquals(1, after.getOutputs().size());
    }

    @Test
    void shouldFailExecutionOnTimeout() {
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(
                CompletableFuture.failedFuture(new ExecutionTimeoutException(Duration.ofMillis(100))));
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "while(true){}", null, null);

        CompletableFuture<Execution> result = store.executeCell(id, cell.getId(), Duration.ofMillis(100));

        CompletionException e = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(ExecutionTimeoutException.class, e.getCause());
        Notebook notebook = store.getNotebook(id).orElseThrow();
        Execution execution = notebook.getExecutions().values().iterator().next();
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals(1, execution.getOutputs().size());
        assertEquals(OutputType.ERROR, execution.getOutputs().get(0).type());
        assertEquals(CellStatus.FAILED, notebook.findCell(cell.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldClampTimeoutToMaximum() {
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(CompletableFuture.completedFuture(
                SandboxPort.SandboxResult.completed(List.of())));
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "1", null, null);

        store.executeCell(id, cell.getId(), Duration.ofMinutes(10)).join();

        verify(sandbox).execute(eq("1"), eq(Duration.ofSeconds(60)), anyInt());
    }

    @Test
    void shouldRejectInvalidExecutions() {
        String id = store.createNotebook(SESSION_ID).getId();
        Cell markdown = store.addCell(id, CellKind.MARKDOWN, "# title", null, null);
        Cell code = store.addCell(id, CellKind.CODE, "1", null, null);
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(new CompletableFuture<>());

        assertThrows(ValidationException.class, () -> store.executeCell(id, markdown.getId(), null));
        assertThrows(ReferenceNotFoundException.class, () -> store.executeCell(id, "missing", null));
        store.executeCell(id, code.getId(), null);
        assertThrows(ValidationException.class, () -> store.executeCell(id, code.getId(), null));
    }

    @Test
    void shouldRejectExecutionsBeyondCeiling() {
        properties.getNotebook().setMaxExecutions(1);
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(CompletableFuture.completedFuture(
                SandboxPort.SandboxResult.completed(List.of())));
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "1", null, null);

        store.executeCell(id, cell.getId(), null).join();

        assertThrows(CapacityExceededException.class, () -> store.executeCell(id, cell.getId(), null));
    }

    @Test
    void shouldExportMarkdown() {
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(CompletableFuture.completedFuture(
                SandboxPort.SandboxResult.completed(List.of(CellOutput.stdout("hello"), CellOutput.stderr("warn"),
                        CellOutput.result("3")))));
        String id = store.createNotebook(SESSION_ID).getId();
        store.addCell(id, CellKind.MARKDOWN, "# Title", null, null);
        Cell code = store.addCell(id, CellKind.CODE, "1 + 2", null, null);
        store.addCell(id, CellKind.CODE, "untouched", null, null);
        store.executeCell(id, code.getId(), null).join();

        String markdown = store.exportToMarkdown(id);

        assertEquals("# Title\n\n"
                + "```javascript\n1 + 2\n```\n"
                + "\n**Output:**\n```\nhello\nError: warn\nResult: 3\n```\n\n"
                + "```javascript\nuntouched\n```\n", markdown);
    }

    @Test
    void shouldExportJsonWithExecutionLog() {
        when(sandbox.execute(anyString(), any(), anyInt())).thenReturn(CompletableFuture.completedFuture(
                SandboxPort.SandboxResult.completed(List.of())));
        String id = store.createNotebook(SESSION_ID).getId();
        Cell cell = store.addCell(id, CellKind.CODE, "1", null, null);
        store.executeCell(id, cell.getId(), null).join();
        store.executeCell(id, cell.getId(), null).join();

        NotebookExport export = store.exportToJson(id);

        assertEquals(id, export.getId());
        assertEquals(SESSION_ID, export.getSessionId());
        assertEquals(1, export.getCells().size());
        assertEquals(2, export.getExecutions().size());
    }

    @Test
    void shouldCreateNotebookFromPreset() {
        NotebookPreset preset = NotebookPreset.builder()
                .key("demo")
                .name("Demo")
                .cells(List.of(
                        NotebookPreset.PresetCell.builder().kind(CellKind.MARKDOWN).source("# Demo").build(),
                        NotebookPreset.PresetCell.builder().kind(CellKind.CODE).source("1").build()))
                .build();
        when(presets.get("demo")).thenReturn(Optional.of(preset));
        when(presets.get("missing")).thenReturn(Optional.empty());

        Notebook notebook = store.createNotebookFromPreset(SESSION_ID, "demo");

        assertEquals(2, notebook.getCells().size());
        assertEquals("demo", notebook.getMetadata().get("preset"));
        assertEquals("javascript", notebook.getCells().get(1).getLanguage());
        assertThrows(ReferenceNotFoundException.class, () -> store.createNotebookFromPreset("other", "missing"));
    }

    @Test
    void shouldSweepIdleNotebooks() {
        String stale = store.createNotebook("stale").getId();
        clock.advance(Duration.ofMinutes(20));
        String fresh = store.createNotebook("fresh").getId();
        clock.advance(Duration.ofMinutes(15));

        scheduler.runPending();

        assertTrue(store.getNotebook(stale).isEmpty());
        assertTrue(store.getNotebook(fresh).isPresent());
    }

    @Test
    void shouldKeepReusedNotebookAliveAcrossSweep() {
        String id = store.createNotebook(SESSION_ID).getId();
        clock.advance(Duration.ofMinutes(20));
        Notebook reused = store.createNotebook(SESSION_ID);
        clock.advance(Duration.ofMinutes(15));

        scheduler.runPending();

        assertEquals(id, reused.getId());
        assertEquals(Instant.parse("2026-03-01T10:20:00Z"), reused.getLastAccessedAt());
        assertTrue(store.getNotebook(id).isPresent());
    }

    @Test
    void shouldRejectMissingSessionId() {
        assertThrows(ValidationException.class, () -> store.createNotebook(null));
        assertThrows(ValidationException.class, () -> store.createNotebook("  "));
        assertEquals(0, store.size());

        store.createNotebook(SESSION_ID);
        assertTrue(store.getNotebookBySession(SESSION_ID).isPresent());
    }

    @Test
    void shouldStopSweepOnCleanup() {
        store.createNotebook(SESSION_ID);

        store.cleanup();

        assertEquals(0, store.size());
        assertEquals(0, scheduler.pendingCount());
        assertFalse(store.deleteNotebook("missing"));
    }
}
