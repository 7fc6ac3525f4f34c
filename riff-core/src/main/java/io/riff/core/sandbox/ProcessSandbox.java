package io.riff.core.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps an interpreter process alive and sends it one JSON line per execution:
 * {@code {"code": ..., "description": ...}} in, {@code {"success": ..., "output": ..., "error": ...}} out.
 * Executions are serialised; a request that outlives the timeout kills the process, which is
 * restarted on the next execution.
 */
public final class ProcessSandbox implements ExecutionSandbox {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessSandbox.class);
    private static final String BRIDGE_RESOURCE = "/sandbox/foxdot_bridge.py";

    private final String command;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    private Process process;
    private ExecutorService readerExecutor;
    private BufferedWriter writer;
    private BufferedReader reader;

    public ProcessSandbox(String command, Duration timeout) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        this.command = command;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Copies the bundled FoxDot bridge script into {@code directory} and returns the command that runs it.
     */
    public static String bundledBridgeCommand(Path directory) throws IOException {
        Files.createDirectories(directory);
        Path script = directory.resolve("foxdot_bridge.py");
        try (InputStream in = ProcessSandbox.class.getResourceAsStream(BRIDGE_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing bundled resource " + BRIDGE_RESOURCE);
            }
            Files.copy(in, script, StandardCopyOption.REPLACE_EXISTING);
        }
        return "python3 " + script.toAbsolutePath();
    }

    @Override
    public String name() {
        return "process";
    }

    @Override
    public synchronized void start() throws IOException {
        if (isRunning()) {
            return;
        }
        stopProcess();
        LOG.info("Starting sandbox process: {}", command);
        process = new ProcessBuilder("/bin/sh", "-c", command)
            .redirectErrorStream(false)
            .start();
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        // A reader left blocked by a timed-out process must not hold up the next one.
        readerExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "riff-sandbox-reader");
            thread.setDaemon(true);
            return thread;
        });

        Process started = process;
        Thread stderrThread = new Thread(() -> drainStderr(started), "riff-sandbox-stderr");
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    public synchronized ExecutionResult execute(String code, String description) {
        List<String> extracted = PlayerExtractor.extract(code);
        try {
            start();
        } catch (IOException e) {
            LOG.warn("Sandbox process could not be started: {}", e.getMessage());
            return ExecutionResult.failure(code, "Sandbox is not available: " + e.getMessage(), extracted);
        }

        long startedAt = System.nanoTime();
        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("code", code);
            request.put("description", description);
            writer.write(mapper.writeValueAsString(request));
            writer.newLine();
            writer.flush();

            Future<String> pending = readerExecutor.submit(reader::readLine);
            String line = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            if (line == null) {
                stopProcess();
                return ExecutionResult.failure(code, "Sandbox process exited", extracted);
            }
            return toResult(code, line, extracted, elapsed);
        } catch (TimeoutException e) {
            LOG.warn("Sandbox execution exceeded {} ms; restarting process", timeout.toMillis());
            stopProcess();
            return ExecutionResult.failure(code, "Execution timed out after " + timeout.toSeconds() + "s", extracted);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopProcess();
            return ExecutionResult.failure(code, "Execution interrupted", extracted);
        } catch (ExecutionException | IOException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            LOG.warn("Sandbox I/O failed: {}", cause.getMessage());
            stopProcess();
            return ExecutionResult.failure(code, "Sandbox I/O failed: " + cause.getMessage(), extracted);
        }
    }

    private ExecutionResult toResult(String code, String line, List<String> extracted, Duration elapsed) throws IOException {
        JsonNode response = mapper.readTree(line);
        Set<String> players = new LinkedHashSet<>(extracted);
        for (JsonNode player : response.path("players")) {
            players.add(player.asText());
        }
        List<String> warnings = new ArrayList<>();
        if (elapsed.compareTo(timeout.dividedBy(2)) > 0) {
            warnings.add("Execution took " + elapsed.toMillis() + " ms");
        }
        return new ExecutionResult(
            response.path("success").asBoolean(false),
            code,
            response.path("output").asText(""),
            response.path("error").asText(""),
            new ArrayList<>(players),
            elapsed,
            warnings
        );
    }

    private boolean isRunning() {
        return process != null && process.isAlive();
    }

    private void drainStderr(Process target) {
        try (BufferedReader stderr = new BufferedReader(new InputStreamReader(target.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = stderr.readLine()) != null) {
                LOG.debug("[sandbox] {}", line);
            }
        } catch (IOException e) {
            LOG.debug("Sandbox stderr closed: {}", e.getMessage());
        }
    }

    private void stopProcess() {
        if (process == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            LOG.debug("Closing sandbox stdin failed: {}", e.getMessage());
        }
        process.destroy();
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        readerExecutor.shutdownNow();
        process = null;
        writer = null;
        reader = null;
        readerExecutor = null;
    }

    @Override
    public synchronized void close() {
        stopProcess();
    }
}
