package com.scheduler.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.scheduler.core.model.ScheduledTask;

/**
 * What a child process needs to run one task. Sent to the child as JSON on stdin.
 */
public record TaskInvocation(
    long taskId,
    String taskUuid,
    long runId,
    String functionName,
    JsonNode args,
    JsonNode kwargs
) {
    public static TaskInvocation of(ScheduledTask task, long runId) {
        return new TaskInvocation(task.id(), task.uuid(), runId,
            task.functionName(), task.args(), task.kwargs());
    }
}
