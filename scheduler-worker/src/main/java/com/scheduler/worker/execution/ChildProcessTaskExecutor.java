package com.scheduler.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs each task in a fresh JVM started from {@link TaskProcessMain}.
 *
 * The invocation goes to the child's stdin; its stdout is the task output and is
 * read by one helper thread; stderr goes to a file that is only read when the
 * child dies without writing its result file. The calling thread watches the
 * child for exit, timeout and stop requests. A timed out or stopped child is
 * killed together with its descendants.
 */
public class ChildProcessTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(ChildProcessTaskExecutor.class);

    private static final int STDERR_TAIL_CHARS = 4000;
    private static final Duration READER_JOIN_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper;
    private final ChildProcessSettings settings;

    public ChildProcessTaskExecutor(ObjectMapper objectMapper, ChildProcessSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public ExecutionOutcome execute(TaskInvocation invocation, Duration timeout,
                                    Duration syncOutputInterval, ExecutionMonitor monitor) {
        Path resultFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            resultFile = createTempFile(invocation, ".result.json");
            stderrFile = createTempFile(invocation, ".stderr.log");
            process = launch(resultFile, stderrFile);
            log.debug("Started task process pid={} for {}", process.pid(), invocation.functionName());

            try (OutputStream stdin = process.getOutputStream()) {
                objectMapper.writeValue(stdin, invocation);
            }

            OutputBuffer output = new OutputBuffer();
            Thread reader = startReader(process.getInputStream(), output, invocation.runId());

            ExecutionOutcome interrupted = watch(process, output, timeout, syncOutputInterval, monitor);
            if (interrupted != null) {
                kill(process);
                reader.join(READER_JOIN_TIMEOUT.toMillis());
                return new ExecutionOutcome(interrupted.status(), output.snapshot(), null, interrupted.traceback());
            }

            reader.join(READER_JOIN_TIMEOUT.toMillis());
            return collect(process.exitValue(), resultFile, stderrFile, output.snapshot());

        } catch (IOException e) {
            log.error("Failed to run task process for {}", invocation.functionName(), e);
            return ExecutionOutcome.failed("", "Could not run task process: " + TaskProcessMain.stackTrace(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.stopped("", "Worker interrupted while the task was running");
        } finally {
            if (process != null && process.isAlive()) {
                kill(process);
            }
            deleteQuietly(resultFile);
            deleteQuietly(stderrFile);
        }
    }

    // ========== Helper Methods ==========

    private Process launch(Path resultFile, Path stderrFile) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(settings.javaCommand());
        command.addAll(settings.jvmArgs());
        command.add("-cp");
        command.add(settings.classpath());
        command.add(TaskProcessMain.class.getName());
        command.add(resultFile.toString());

        return new ProcessBuilder(command)
            .redirectError(stderrFile.toFile())
            .start();
    }

    /**
     * Wait for the child to exit.
     *
     * @return null when the child exited by itself, otherwise why it has to be killed
     */
    private ExecutionOutcome watch(Process process, OutputBuffer output, Duration timeout,
                                   Duration syncOutputInterval, ExecutionMonitor monitor)
            throws InterruptedException {
        long started = System.nanoTime();
        long lastSync = started;
        long lastStopCheck = started;
        long syncedVersion = 0;

        while (!process.waitFor(settings.monitorInterval().toMillis(), TimeUnit.MILLISECONDS)) {
            long now = System.nanoTime();

            if (now - started >= timeout.toNanos()) {
                log.warn("Task process pid={} exceeded its timeout of {}s, killing it",
                    process.pid(), timeout.toSeconds());
                return ExecutionOutcome.timedOut(null, "Task exceeded its timeout of " + timeout);
            }

            if (now - lastStopCheck >= settings.stopCheckInterval().toNanos()) {
                lastStopCheck = now;
                if (monitor.shouldStop()) {
                    log.info("Killing task process pid={} on request", process.pid());
                    return ExecutionOutcome.stopped(null, "Task was stopped while running");
                }
            }

            if (!syncOutputInterval.isZero() && now - lastSync >= syncOutputInterval.toNanos()) {
                lastSync = now;
                long version = output.version();
                if (version != syncedVersion) {
                    syncedVersion = version;
                    monitor.onOutput(output.snapshot());
                }
            }
        }
        return null;
    }

    private ExecutionOutcome collect(int exitCode, Path resultFile, Path stderrFile, String output)
            throws IOException {
        if (Files.size(resultFile) > 0) {
            ChildResult result = objectMapper.readValue(resultFile.toFile(), ChildResult.class);
            if (result.completed()) {
                JsonNode value = result.result() == null || result.result().isNull() ? null : result.result();
                return ExecutionOutcome.completed(output, value);
            }
            return ExecutionOutcome.failed(output, result.traceback());
        }

        String stderr = tail(stderrFile);
        log.warn("Task process exited with code {} without a result", exitCode);
        return ExecutionOutcome.failed(output,
            "Task process exited with code " + exitCode + " without a result\n" + stderr);
    }

    private Thread startReader(InputStream stdout, OutputBuffer output, long runId) {
        Thread reader = new Thread(() -> {
            char[] chunk = new char[4096];
            try (Reader in = new InputStreamReader(stdout, StandardCharsets.UTF_8)) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    output.append(new String(chunk, 0, read));
                }
            } catch (IOException e) {
                // The stream closes under us when the child is killed
                log.debug("Output stream of run {} closed: {}", runId, e.getMessage());
            }
        }, "task-output-" + runId);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Task process pid={} did not exit after being killed", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Path createTempFile(TaskInvocation invocation, String suffix) throws IOException {
        String prefix = "scheduler-run-" + invocation.runId() + "-";
        return settings.workDirectory() != null
            ? Files.createTempFile(settings.workDirectory(), prefix, suffix)
            : Files.createTempFile(prefix, suffix);
    }

    private static String tail(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return text.length() <= STDERR_TAIL_CHARS ? text : text.substring(text.length() - STDERR_TAIL_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}", file, e);
        }
    }
}
