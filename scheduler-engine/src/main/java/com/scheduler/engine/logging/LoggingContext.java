package com.scheduler.engine.logging;

import org.slf4j.MDC;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures worker and task logs carry the identifiers needed to follow one run.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(task.id(), task.uuid())) {
 *     log.info("Dispatching task"); // Automatically includes taskId, taskUuid
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [scheduler-worker] INFO  c.s.w.SchedulerWorker - Dispatching task
 *   workerId=host-1#4242 taskId=17 taskUuid=nightly-report runId=381
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKER_ID = "workerId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_UUID = "taskUuid";
    public static final String RUN_ID = "runId";

    private final boolean taskScope;

    private LoggingContext(boolean taskScope) {
        this.taskScope = taskScope;
    }

    /**
     * Create a logging context for worker operations.
     * Closing it clears the worker and any task keys.
     */
    public static LoggingContext forWorker(String workerId) {
        if (workerId != null) {
            MDC.put(WORKER_ID, workerId);
        }
        return new LoggingContext(false);
    }

    /**
     * Create a logging context for one task. Closing it keeps the worker key.
     */
    public static LoggingContext forTask(long taskId, String taskUuid) {
        MDC.put(TASK_ID, String.valueOf(taskId));
        if (taskUuid != null) {
            MDC.put(TASK_UUID, taskUuid);
        }
        return new LoggingContext(true);
    }

    /**
     * Add the run ID once the run record exists.
     */
    public static void setRunId(long runId) {
        MDC.put(RUN_ID, String.valueOf(runId));
    }

    /**
     * Get current task ID from context.
     */
    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    /**
     * Get current worker ID from context.
     */
    public static String getWorkerId() {
        return MDC.get(WORKER_ID);
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(TASK_UUID);
        MDC.remove(RUN_ID);
        if (!taskScope) {
            MDC.remove(WORKER_ID);
        }
    }
}
