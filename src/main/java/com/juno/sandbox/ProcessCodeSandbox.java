package com.juno.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.juno.core.config.JunoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executes snippets with a local interpreter in a scratch directory.
 * <p>
 * The snippet is written to a temp file and run with the configured command.
 * The context is passed as JSON in the {@code JUNO_CONTEXT} environment
 * variable, and {@code RESULT name=value} lines on stdout become result
 * bindings. Timeouts and launch failures are reported through stderr.
 */
@Service
public class ProcessCodeSandbox implements CodeSandbox {

    private static final Logger log = LoggerFactory.getLogger(ProcessCodeSandbox.class);

    static final String CONTEXT_ENV = "JUNO_CONTEXT";
    private static final Pattern RESULT_LINE = Pattern.compile("^RESULT\\s+([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private final JunoProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ProcessCodeSandbox(JunoProperties properties) {
        this.properties = properties;
    }

    @Override
    public SandboxResult submit(String code, Map<String, Object> context) {
        var sandbox = properties.getSandbox();
        Path workDir = Paths.get(properties.getSandboxDirectory());
        Path script = null;
        Path out = null;
        Path err = null;
        try {
            Files.createDirectories(workDir);
            script = Files.createTempFile(workDir, "snippet-", ".src");
            out = Files.createTempFile(workDir, "snippet-", ".out");
            err = Files.createTempFile(workDir, "snippet-", ".err");
            Files.writeString(script, code, StandardCharsets.UTF_8);

            var builder = new ProcessBuilder(List.of(sandbox.getCommand(), script.toString()))
                    .directory(workDir.toFile())
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());
            builder.environment().put(CONTEXT_ENV, objectMapper.writeValueAsString(context));
            log.debug("Running snippet with {}", sandbox.getCommand());

            var process = builder.start();
            if (!process.waitFor(sandbox.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new SandboxResult(Files.readString(out, StandardCharsets.UTF_8),
                        "Execution timed out after " + sandbox.getTimeoutSeconds() + "s", Map.of());
            }
            String stdout = Files.readString(out, StandardCharsets.UTF_8);
            String stderr = Files.readString(err, StandardCharsets.UTF_8);
            if (process.exitValue() != 0 && stderr.isBlank()) {
                stderr = "Process exited with code " + process.exitValue();
            }
            return new SandboxResult(stdout, stderr, parseBindings(stdout));
        } catch (JsonProcessingException e) {
            return SandboxResult.error("Context could not be serialized: " + e.getMessage());
        } catch (IOException e) {
            log.warn("Sandbox execution failed: {}", e.getMessage());
            return SandboxResult.error("Sandbox execution failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SandboxResult.error("Sandbox execution interrupted");
        } finally {
            deleteQuietly(script);
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    static Map<String, String> parseBindings(String stdout) {
        var bindings = new LinkedHashMap<String, String>();
        for (String line : stdout.split("\\R")) {
            Matcher m = RESULT_LINE.matcher(line.trim());
            if (m.matches()) {
                bindings.put(m.group(1), m.group(2).trim());
            }
        }
        return bindings;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
