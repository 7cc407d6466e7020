package com.scheduler.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.scheduler.core.model.RunStatus;

/**
 * How a run ended, as observed by the worker.
 *
 * @param status COMPLETED, FAILED, TIMEOUT or STOPPED
 * @param output Everything the task printed, after {@code !clear!} handling
 * @param result The function's return value, COMPLETED only
 * @param traceback Failure details, never set when COMPLETED
 */
public record ExecutionOutcome(
    RunStatus status,
    String output,
    JsonNode result,
    String traceback
) {
    public static ExecutionOutcome completed(String output, JsonNode result) {
        return new ExecutionOutcome(RunStatus.COMPLETED, output, result, null);
    }

    public static ExecutionOutcome failed(String output, String traceback) {
        return new ExecutionOutcome(RunStatus.FAILED, output, null, traceback);
    }

    public static ExecutionOutcome timedOut(String output, String traceback) {
        return new ExecutionOutcome(RunStatus.TIMEOUT, output, null, traceback);
    }

    public static ExecutionOutcome stopped(String output, String traceback) {
        return new ExecutionOutcome(RunStatus.STOPPED, output, null, traceback);
    }
}
