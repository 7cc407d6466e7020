package com.scheduler.core.model;

import java.util.Set;

/**
 * Lifecycle states for a scheduled task.
 */
public enum TaskStatus {
    /**
     * Waiting for its next run time.
     * Transitions: -> ASSIGNED, STOPPED, EXPIRED
     */
    QUEUED,

    /**
     * Claimed by a worker, not yet dispatched.
     * Transitions: -> RUNNING, QUEUED (reclaimed), STOPPED
     */
    ASSIGNED,

    /**
     * A child process is executing the task.
     * Transitions: -> QUEUED, COMPLETED, FAILED, TIMEOUT, STOPPED
     */
    RUNNING,

    /**
     * No further runs: repeats exhausted, one-shot done or past stop time.
     */
    COMPLETED,

    /**
     * Last run failed and the retry budget is spent.
     */
    FAILED,

    /**
     * Last run exceeded its timeout and the retry budget is spent.
     */
    TIMEOUT,

    /**
     * Cancelled by a caller.
     */
    STOPPED,

    /**
     * Stop time passed before the task could run again.
     */
    EXPIRED;

    private static final Set<TaskStatus> TERMINAL = Set.of(COMPLETED, FAILED, TIMEOUT, STOPPED, EXPIRED);

    /**
     * Check if this state is terminal (no further runs).
     */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Check if a worker currently owns the task.
     */
    public boolean isActive() {
        return this == ASSIGNED || this == RUNNING;
    }

    /**
     * Check if a caller may cancel the task from this state.
     */
    public boolean isStoppable() {
        return this == QUEUED || this == ASSIGNED || this == RUNNING;
    }
}
