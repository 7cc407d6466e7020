package com.scheduler.core.schedule;

import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskStatus;

import java.time.Instant;

/**
 * Task state to write back after a run finished.
 *
 * @param status QUEUED to run again, otherwise terminal
 * @param nextRunTime Next fire time; unchanged from the task when terminal
 * @param succeeded Whether the run completed; successors waiting on this task become
 *                  satisfied and the task's own dependencies start a new run-cycle
 */
public record RunTransition(
    TaskStatus status,
    Instant nextRunTime,
    int repeats,
    int timesRun,
    int retryFailed,
    int timesFailed,
    boolean succeeded
) {
    public boolean isRequeued() {
        return status == TaskStatus.QUEUED;
    }

    /**
     * Apply the transition to a task, releasing worker ownership.
     */
    public ScheduledTask applyTo(ScheduledTask task, Instant now) {
        return task.toBuilder()
            .status(status)
            .nextRunTime(nextRunTime)
            .repeats(repeats)
            .timesRun(timesRun)
            .retryFailed(retryFailed)
            .timesFailed(timesFailed)
            .assignedWorker(null)
            .updatedAt(now)
            .build();
    }
}
