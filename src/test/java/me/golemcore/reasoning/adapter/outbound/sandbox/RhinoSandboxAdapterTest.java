package me.golemcore.reasoning.adapter.outbound.sandbox;

import me.golemcore.reasoning.domain.exception.ExecutionTimeoutException;
import me.golemcore.reasoning.domain.notebook.CellOutput;
import me.golemcore.reasoning.port.outbound.SandboxPort.SandboxResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RhinoSandboxAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_OUTPUT = 262_144;

    private RhinoSandboxAdapter sandbox;

    @BeforeEach
    void setUp() {
        sandbox = new RhinoSandboxAdapter();
    }

    @AfterEach
    void tearDown() {
        sandbox.shutdown();
    }

    @Test
    void shouldCaptureConsoleAndResult() {
        SandboxResult result = sandbox.execute(
                "console.log('a', 1); console.error('bad'); console.info('i'); 6 * 7", TIMEOUT, MAX_OUTPUT).join();

        assertFalse(result.isFailed());
        assertEquals(List.of(
                CellOutput.stdout("a 1"),
                CellOutput.stderr("bad"),
                CellOutput.stdout("i"),
                CellOutput.result("42")), result.outputs());
    }

    @Test
    void shouldOmitUndefinedResult() {
        SandboxResult result = sandbox.execute("var x = 1;", TIMEOUT, MAX_OUTPUT).join();

        assertTrue(result.outputs().isEmpty());
    }

    @Test
    void shouldRenderObjectsAsJson() {
        SandboxResult result = sandbox.execute("console.log({a: 1}); [1, 2]", TIMEOUT, MAX_OUTPUT).join();

        assertEquals("{\n  \"a\": 1\n}", result.outputs().get(0).data());
        assertEquals("[\n  1,\n  2\n]", result.outputs().get(1).data());
    }

    @Test
    void shouldReportThrownErrorAndKeepEarlierOutput() {
        SandboxResult result = sandbox.execute("console.log('before'); throw new Error('boom');", TIMEOUT,
                MAX_OUTPUT).join();

        assertTrue(result.isFailed());
        assertTrue(result.error().contains("boom"));
        assertEquals(List.of(CellOutput.stdout("before")), result.outputs());
    }

    @Test
    void shouldReportSyntaxError() {
        SandboxResult result = sandbox.execute("function (", TIMEOUT, MAX_OUTPUT).join();

        assertTrue(result.isFailed());
    }

    @Test
    void shouldReportStackExhaustionAsFailureInsteadOfTimeout() {
        SandboxResult result = sandbox.execute(
                "console.log('start'); var a = []; for (var i = 0; i < 200000; i++) { a = [a]; } a",
                Duration.ofSeconds(10), MAX_OUTPUT).join();

        assertTrue(result.isFailed());
        assertEquals(List.of(CellOutput.stdout("start")), result.outputs());

        SandboxResult next = sandbox.execute("1 + 1", TIMEOUT, MAX_OUTPUT).join();
        assertFalse(next.isFailed());
    }

    @Test
    void shouldTimeOutInfiniteLoop() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> sandbox.execute("while (true) {}", Duration.ofMillis(200), MAX_OUTPUT).join());

        assertInstanceOf(ExecutionTimeoutException.class, e.getCause());
    }

    @Test
    void shouldHideHostClasses() {
        SandboxResult result = sandbox.execute("java.lang.System.exit(1)", TIMEOUT, MAX_OUTPUT).join();

        assertTrue(result.isFailed());
    }

    @Test
    void shouldNotExposeHostGlobals() {
        SandboxResult result = sandbox.execute(
                "typeof Packages + ',' + typeof require + ',' + typeof process", TIMEOUT, MAX_OUTPUT).join();

        assertEquals("undefined,undefined,undefined", result.outputs().get(0).data());
    }

    @Test
    void shouldDropOutputBeyondCeiling() {
        SandboxResult result = sandbox.execute(
                "for (var i = 0; i < 100; i++) { console.log('0123456789'); }", TIMEOUT, 35).join();

        assertEquals(3, result.outputs().size());
    }

    @Test
    void shouldIsolateScopesBetweenRuns() {
        sandbox.execute("var leaked = 1;", TIMEOUT, MAX_OUTPUT).join();

        SandboxResult result = sandbox.execute("typeof leaked", TIMEOUT, MAX_OUTPUT).join();

        assertEquals("undefined", result.outputs().get(0).data());
    }
}
