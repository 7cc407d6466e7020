package com.scheduler.core.model;

/**
 * Administrative state of a worker process.
 */
public enum WorkerStatus {
    /**
     * Polls, claims and executes tasks.
     */
    ACTIVE,

    /**
     * Keeps heartbeating but claims nothing.
     */
    DISABLED,

    /**
     * Finishes its current run, deregisters and exits.
     */
    TERMINATING
}
