package com.juno.sandbox;

import java.util.Map;

/**
 * Output of a sandboxed execution. Any stderr output means the code failed.
 *
 * @param bindings values the code reported via {@code RESULT name=value} lines
 */
public record SandboxResult(String stdout, String stderr, Map<String, String> bindings) {

    public SandboxResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        bindings = bindings == null ? Map.of() : Map.copyOf(bindings);
    }

    public static SandboxResult error(String message) {
        return new SandboxResult("", message, Map.of());
    }

    public boolean failed() {
        return !stderr.isBlank();
    }
}
