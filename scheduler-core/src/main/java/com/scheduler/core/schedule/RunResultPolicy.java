package com.scheduler.core.schedule;

import com.scheduler.core.model.RetryPolicy;
import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskStatus;

import java.time.Instant;

/**
 * Decides what happens to a task after one of its runs finished.
 *
 * Success: count the run, spend one repeat and either requeue at the next fire
 * time or finish as COMPLETED. A next fire time equal to the stop time still runs.
 *
 * Failure or timeout: count the failure and requeue per the retry policy while
 * retry budget remains, otherwise finish as FAILED or TIMEOUT.
 *
 * Pure: reads nothing but its arguments.
 */
public class RunResultPolicy {

    private final ScheduleCalculator calculator;
    private final RetryPolicy retryPolicy;

    public RunResultPolicy(ScheduleCalculator calculator, RetryPolicy retryPolicy) {
        this.calculator = calculator;
        this.retryPolicy = retryPolicy;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * Compute the transition for a finished run.
     *
     * @param task The task as it was claimed
     * @param result COMPLETED, FAILED or TIMEOUT
     * @param finishedAt When the run ended
     */
    public RunTransition decide(ScheduledTask task, RunStatus result, Instant finishedAt) {
        return switch (result) {
            case COMPLETED -> onSuccess(task, finishedAt);
            case FAILED -> onFailure(task, TaskStatus.FAILED, finishedAt);
            case TIMEOUT -> onFailure(task, TaskStatus.TIMEOUT, finishedAt);
            default -> throw new IllegalArgumentException("No transition for run result " + result);
        };
    }

    private RunTransition onSuccess(ScheduledTask task, Instant finishedAt) {
        int timesRun = task.timesRun() + 1;
        boolean lastRepeat = !task.hasUnlimitedRepeats() && task.repeats() <= 1;
        Instant next = calculator.nextRunTime(task, finishedAt);

        if (lastRepeat || next == null || isBeyondStop(task, next)) {
            return new RunTransition(TaskStatus.COMPLETED, task.nextRunTime(), task.repeats(),
                timesRun, task.retryFailed(), task.timesFailed(), true);
        }

        int repeats = task.hasUnlimitedRepeats() ? 0 : task.repeats() - 1;
        return new RunTransition(TaskStatus.QUEUED, next, repeats,
            timesRun, task.retryFailed(), task.timesFailed(), true);
    }

    private RunTransition onFailure(ScheduledTask task, TaskStatus terminalStatus, Instant finishedAt) {
        int timesFailed = task.timesFailed() + 1;

        if (task.retryFailed() > 0) {
            Instant scheduled = calculator.nextRunTime(task, finishedAt);
            Instant retryAt = retryPolicy.retryAt(finishedAt, timesFailed, scheduled);
            if (!isBeyondStop(task, retryAt)) {
                return new RunTransition(TaskStatus.QUEUED, retryAt, task.repeats(),
                    task.timesRun(), task.retryFailed() - 1, timesFailed, false);
            }
        }

        return new RunTransition(terminalStatus, task.nextRunTime(), task.repeats(),
            task.timesRun(), task.retryFailed(), timesFailed, false);
    }

    private static boolean isBeyondStop(ScheduledTask task, Instant next) {
        return task.stopTime() != null && next.isAfter(task.stopTime());
    }
}
