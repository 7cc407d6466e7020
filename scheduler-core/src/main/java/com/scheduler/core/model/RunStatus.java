package com.scheduler.core.model;

/**
 * Outcome of a single execution attempt.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    STOPPED,

    /**
     * The worker holding the run stopped heartbeating; the task was requeued.
     */
    LOST;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
