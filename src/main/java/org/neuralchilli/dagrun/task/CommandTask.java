package org.neuralchilli.dagrun.task;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.neuralchilli.dagrun.core.ParameterStore;
import org.neuralchilli.dagrun.core.TaskExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a shell command line as a child process.
 * <p>
 * {@code ${name}} tokens in the command are filled from the global store first and then
 * from this task's own resolved parameters. A zero exit code is success; when the last
 * output line is a JSON object its fields are merged into the result so downstream tasks
 * can consume structured data.
 */
public class CommandTask extends AbstractTask {

    private static final Logger log = LoggerFactory.getLogger(CommandTask.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String commandTemplate;
    private final Path workingDir;
    private final int timeoutSeconds;

    private String command;

    public CommandTask(String id, String command, Map<String, Object> params, Path workingDir, int timeoutSeconds) {
        super(id, "command", params);
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Command task '" + id + "' needs a command");
        }
        this.commandTemplate = command;
        this.command = command;
        this.workingDir = workingDir;
        this.timeoutSeconds = timeoutSeconds > 0 ? timeoutSeconds : 3600;
    }

    public CommandTask(String id, String command, Map<String, Object> params) {
        this(id, command, params, null, 3600);
    }

    @Override
    public void resolveParams(ParameterStore store) {
        super.resolveParams(store);
        command = store.resolve(commandTemplate);
    }

    /**
     * The command line as it will be executed
     */
    public String resolvedCommand() {
        Matcher matcher = PLACEHOLDER.matcher(command);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = param(matcher.group(1));
            String replacement = value != null ? value.toString() : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public Object execute(Map<String, Object> upstreamResults) throws Exception {
        String commandLine = resolvedCommand();
        log.info("[{}] Executing command: {}", id(), commandLine);

        ProcessBuilder pb = new ProcessBuilder(List.of("sh", "-c", commandLine));
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // Single stream keeps output ordering intact in the log
        pb.redirectErrorStream(true);

        Process process = pb.start();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process));

        String captured;
        try {
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new TaskExecutionException(id(),
                        "Command timed out after " + timeoutSeconds + " seconds: " + commandLine);
            }
            captured = output.get();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TaskExecutionException(id(), "Command interrupted: " + commandLine, e);
        } catch (ExecutionException e) {
            throw new TaskExecutionException(id(), "Failed to read command output: " + e.getCause().getMessage(), e.getCause());
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new TaskExecutionException(id(), "Command exited with code " + exitCode + ": " + captured.trim());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("exit_code", exitCode);
        result.put("output", captured.trim());
        result.putAll(tryParseJsonOutput(captured));
        return result;
    }

    private String readOutput(Process process) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
                log.info("[{}] {}", id(), line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }

    /**
     * Parse the last output line as a JSON object, if it is one.
     */
    private Map<String, Object> tryParseJsonOutput(String output) {
        String[] lines = output.trim().split("\n");
        String lastLine = lines[lines.length - 1].trim();

        if (!lastLine.startsWith("{") || !lastLine.endsWith("}")) {
            return Map.of();
        }

        try {
            return objectMapper.readValue(lastLine, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            // Not JSON, that's fine
            log.trace("Last line is not valid JSON: {}", e.getMessage());
            return Map.of();
        }
    }

    public String commandTemplate() {
        return commandTemplate;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }
}
