package com.cronflow.cronflow_backend.engine.runner;

import com.cronflow.cronflow_backend.model.domain.EventType;
import com.cronflow.cronflow_backend.model.run.EventExecutionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs event scripts in a subprocess.
 *
 * Supported event types:
 *   NODEJS: executed via `node`
 *   PYTHON: executed via `python3`
 *   BASH: executed via `bash`
 *
 * How it works:
 *   1. Create a temp working directory and write the resolved input to input.json
 *   2. Prepend a small prelude exposing the `flow` helpers to the user's code
 *   3. Run the subprocess with stdout/stderr redirected to files (no pipe back-pressure)
 *   4. Read stdout as raw output, output.json as scriptOutput, condition.json as condition
 *   5. Delete the working directory
 *
 * Helpers available to scripts:
 *   flow.input(): the resolved input object
 *   flow.output(data): payload handed to the next node's flow.input()
 *   flow.setCondition(bool): flag read by ON_CONDITION connections
 * Bash gets flow_input, flow_output and flow_set_condition functions instead.
 *
 * Exit code 0 means success. Process is force-killed on timeout.
 */
@Slf4j
@Service
public class ScriptRunner {

    private static final String INPUT_FILE     = "input.json";
    private static final String OUTPUT_FILE    = "output.json";
    private static final String CONDITION_FILE = "condition.json";

    private final ObjectMapper objectMapper;
    private final String nodeCommand;
    private final String pythonCommand;
    private final String bashCommand;

    public ScriptRunner(ObjectMapper objectMapper,
                        @Value("${cronflow.runner.node-command:node}") String nodeCommand,
                        @Value("${cronflow.runner.python-command:python3}") String pythonCommand,
                        @Value("${cronflow.runner.bash-command:bash}") String bashCommand) {
        this.objectMapper = objectMapper;
        this.nodeCommand = nodeCommand;
        this.pythonCommand = pythonCommand;
        this.bashCommand = bashCommand;
    }

    // ── Public API ────────────────────────────────────────────────────────────

    public EventExecutionResult run(EventType type, String userCode, Map<String, Object> inputData, int timeoutSeconds) {
        String code = userCode != null ? userCode : "";
        return switch (type) {
            case NODEJS       -> runScript("js", buildJsWrapper(code),   inputData, nodeCommand,   timeoutSeconds);
            case PYTHON       -> runScript("py", buildPyWrapper(code),   inputData, pythonCommand, timeoutSeconds);
            case BASH         -> runScript("sh", buildBashWrapper(code), inputData, bashCommand,   timeoutSeconds);
            case HTTP_REQUEST -> EventExecutionResult.error("HTTP_REQUEST events are not scripts.");
        };
    }

    // ── Script wrappers ───────────────────────────────────────────────────────

    String buildJsWrapper(String userCode) {
        return """
                const fs = require('fs');
                const flow = {
                    input: () => JSON.parse(fs.readFileSync(process.env.FLOW_INPUT_FILE, 'utf8')),
                    output: (data) => fs.writeFileSync(process.env.FLOW_OUTPUT_FILE, JSON.stringify(data)),
                    setCondition: (value) => fs.writeFileSync(process.env.FLOW_CONDITION_FILE, JSON.stringify(Boolean(value))),
                };

                (async () => {
                %s
                })().catch((e) => {
                    console.error(e && e.message ? e.message : String(e));
                    process.exit(1);
                });
                """.formatted(userCode);
    }

    String buildPyWrapper(String userCode) {
        return """
                import json, os

                class _Flow:
                    def input(self):
                        with open(os.environ["FLOW_INPUT_FILE"]) as f:
                            return json.load(f)

                    def output(self, data):
                        with open(os.environ["FLOW_OUTPUT_FILE"], "w") as f:
                            json.dump(data, f)

                    def setCondition(self, value):
                        with open(os.environ["FLOW_CONDITION_FILE"], "w") as f:
                            json.dump(bool(value), f)

                flow = _Flow()

                %s
                """.formatted(userCode);
    }

    String buildBashWrapper(String userCode) {
        return """
                flow_input() { cat "$FLOW_INPUT_FILE"; }
                flow_output() { printf '%%s' "$1" > "$FLOW_OUTPUT_FILE"; }
                flow_set_condition() {
                    if [ "$1" = "true" ]; then echo true > "$FLOW_CONDITION_FILE"; else echo false > "$FLOW_CONDITION_FILE"; fi
                }

                %s
                """.formatted(userCode);
    }

    // ── Core subprocess runner ────────────────────────────────────────────────

    private EventExecutionResult runScript(String extension, String wrappedCode, Map<String, Object> inputData,
                                           String interpreter, int timeoutSeconds) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("cf_event_");
            Path inputFile  = workDir.resolve(INPUT_FILE);
            Path scriptFile = workDir.resolve("script." + extension);
            Path stdoutFile = workDir.resolve("stdout.log");
            Path stderrFile = workDir.resolve("stderr.log");

            Files.writeString(inputFile,  objectMapper.writeValueAsString(inputData != null ? inputData : Map.of()));
            Files.writeString(scriptFile, wrappedCode);

            ProcessBuilder builder = new ProcessBuilder(interpreter, scriptFile.toString())
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            Map<String, String> env = builder.environment();
            env.put("FLOW_INPUT_FILE",     inputFile.toString());
            env.put("FLOW_OUTPUT_FILE",    workDir.resolve(OUTPUT_FILE).toString());
            env.put("FLOW_CONDITION_FILE", workDir.resolve(CONDITION_FILE).toString());

            Process process = builder.start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                return EventExecutionResult.error("Script timed out after " + timeoutSeconds + " seconds.");
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8).trim();
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
            int exitCode = process.exitValue();

            if (exitCode != 0) {
                String error = !stderr.isEmpty() ? stderr
                        : !stdout.isEmpty() ? stdout
                        : "Script exited with code " + exitCode + ".";
                return new EventExecutionResult(false, error, null, readScriptOutput(workDir), readCondition(workDir));
            }
            return new EventExecutionResult(true, stdout, null, readScriptOutput(workDir), readCondition(workDir));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EventExecutionResult.error("Script execution was interrupted.");
        } catch (IOException e) {
            log.error("ScriptRunner IO error: {}", e.getMessage());
            return EventExecutionResult.error("Failed to run script: " + e.getMessage());
        } finally {
            // Always clean up the working directory
            deleteRecursively(workDir);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Object readScriptOutput(Path workDir) {
        Path file = workDir.resolve(OUTPUT_FILE);
        if (!Files.exists(file)) return null;
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (raw.isEmpty()) return null;
            return objectMapper.readValue(raw, Object.class);
        } catch (IOException e) {
            log.warn("Script wrote an unreadable {}: {}", OUTPUT_FILE, e.getMessage());
            return null;
        }
    }

    private Boolean readCondition(Path workDir) {
        Path file = workDir.resolve(CONDITION_FILE);
        if (!Files.exists(file)) return null;
        try {
            return Boolean.parseBoolean(Files.readString(file, StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            log.warn("Script wrote an unreadable {}: {}", CONDITION_FILE, e.getMessage());
            return null;
        }
    }

    private void deleteRecursively(Path dir) {
        if (dir == null) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
