package com.scheduler.worker.execution;

/**
 * Callbacks from a running task back to its worker.
 */
public interface ExecutionMonitor {

    /**
     * Called with the full output so far, at most once per sync interval and
     * only when it changed.
     */
    void onOutput(String output);

    /**
     * Polled while the task runs.
     *
     * @return true to kill the task, e.g. after it was stopped or reassigned
     */
    boolean shouldStop();
}
