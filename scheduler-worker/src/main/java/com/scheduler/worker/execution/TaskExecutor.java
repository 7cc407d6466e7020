package com.scheduler.worker.execution;

import java.time.Duration;

/**
 * Runs one task invocation to its end and reports how it went.
 * Failures of the task itself are reported in the outcome, never thrown.
 */
public interface TaskExecutor {

    /**
     * @param invocation The task to run
     * @param timeout Wall-clock limit; the task is killed when it is exceeded
     * @param syncOutputInterval How often to report output while running, zero for never
     * @param monitor Receives output and is asked whether to stop
     */
    ExecutionOutcome execute(TaskInvocation invocation, Duration timeout,
                             Duration syncOutputInterval, ExecutionMonitor monitor);
}
