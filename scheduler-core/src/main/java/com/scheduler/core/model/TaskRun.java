package com.scheduler.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;

/**
 * A single attempt to execute a task.
 * Multiple runs exist for the same task (repeats and retries).
 *
 * Primary Key: runId
 *
 * Invariants:
 * - stopTime set iff status is finished
 * - result set only when status == COMPLETED
 * - traceback set only when status is FAILED, TIMEOUT or LOST
 */
public record TaskRun(
    // Primary key, assigned by the registry
    Long runId,

    // Foreign key
    long taskId,
    String workerId,

    // State
    RunStatus status,

    // Timing
    Instant startTime,
    Instant stopTime,

    // Data
    String output,
    JsonNode result,
    String traceback
) {
    /**
     * Create a new run in RUNNING state.
     */
    public static TaskRun start(long taskId, String workerId, Instant startTime) {
        return new TaskRun(
            null,
            taskId,
            workerId,
            RunStatus.RUNNING,
            startTime,
            null,
            null,
            null,
            null
        );
    }

    /**
     * Create a copy with the registry-assigned id.
     */
    public TaskRun withRunId(long id) {
        return new TaskRun(id, taskId, workerId, status, startTime, stopTime, output, result, traceback);
    }

    /**
     * Create a copy with partial output synced while running.
     */
    public TaskRun withOutput(String newOutput) {
        return new TaskRun(runId, taskId, workerId, status, startTime, stopTime, newOutput, result, traceback);
    }

    /**
     * Create a copy with the run finished.
     */
    public TaskRun withFinished(RunStatus finalStatus, Instant finishedAt, String finalOutput,
                                JsonNode finalResult, String finalTraceback) {
        return new TaskRun(
            runId, taskId, workerId, finalStatus,
            startTime, finishedAt,
            finalOutput,
            finalStatus == RunStatus.COMPLETED ? finalResult : null,
            finalTraceback
        );
    }

    /**
     * Wall-clock duration of a finished run.
     */
    public Duration duration() {
        return stopTime != null ? Duration.between(startTime, stopTime) : Duration.ZERO;
    }
}
