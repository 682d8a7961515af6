package com.juno.sandbox;

import com.juno.core.config.JunoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs snippets through {@code sh} so the tests need no extra interpreter.
 */
@DisabledOnOs(OS.WINDOWS)
class ProcessCodeSandboxTest {

    @TempDir
    Path sandboxDir;

    private JunoProperties properties;
    private ProcessCodeSandbox sandbox;

    @BeforeEach
    void setUp() {
        properties = new JunoProperties();
        properties.setSandboxDirectory(sandboxDir.toString());
        properties.getSandbox().setCommand("sh");
        properties.getSandbox().setTimeoutSeconds(10);
        sandbox = new ProcessCodeSandbox(properties);
    }

    @Test
    @DisplayName("stdout and RESULT bindings are captured")
    void bindings() {
        var result = sandbox.submit("echo hello\necho 'RESULT score=0.8'\n", Map.of());

        assertFalse(result.failed());
        assertTrue(result.stdout().startsWith("hello"));
        assertEquals(Map.of("score", "0.8"), result.bindings());
    }

    @Test
    @DisplayName("the context is passed as JSON in the environment")
    void context() {
        var result = sandbox.submit("echo \"$JUNO_CONTEXT\"\n", Map.of("team", "writing"));

        assertEquals("{\"team\":\"writing\"}", result.stdout().trim());
    }

    @Test
    @DisplayName("stderr output marks the execution as failed")
    void stderr() {
        var result = sandbox.submit("echo broken >&2\n", Map.of());

        assertTrue(result.failed());
        assertEquals("broken", result.stderr().trim());
    }

    @Test
    @DisplayName("a silent non-zero exit is reported with its code")
    void exitCode() {
        var result = sandbox.submit("exit 3\n", Map.of());

        assertEquals("Process exited with code 3", result.stderr());
    }

    @Test
    @DisplayName("a snippet running past the timeout is stopped")
    void timeout() {
        properties.getSandbox().setTimeoutSeconds(1);

        var result = sandbox.submit("sleep 5\n", Map.of());

        assertEquals("Execution timed out after 1s", result.stderr());
    }

    @Test
    @DisplayName("a missing interpreter is reported as a failure")
    void missingCommand() {
        properties.getSandbox().setCommand("juno-no-such-interpreter");

        var result = sandbox.submit("echo hi\n", Map.of());

        assertTrue(result.failed());
        assertTrue(result.stderr().startsWith("Sandbox execution failed: "));
    }

    @Test
    @DisplayName("scratch files are removed after each run")
    void cleansUp() throws Exception {
        sandbox.submit("echo hi\n", Map.of());

        try (Stream<Path> files = Files.list(sandboxDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("parseBindings ignores lines that are not RESULT lines")
    void parseBindings() {
        var bindings = ProcessCodeSandbox.parseBindings("noise\nRESULT a=1\n  RESULT b = x\nRESULT 9bad=2\nRESULT c= spaced \n");

        assertEquals(Map.of("a", "1", "c", "spaced"), bindings);
    }
}
