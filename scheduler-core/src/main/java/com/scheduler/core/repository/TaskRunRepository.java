package com.scheduler.core.repository;

import com.scheduler.core.model.TaskRun;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for TaskRun persistence.
 * Runs are append-only history; they are never deleted.
 */
public interface TaskRunRepository {

    /**
     * Save a new run.
     *
     * @param run The run to save; its id is ignored
     * @return The run with its assigned id
     */
    TaskRun save(TaskRun run);

    /**
     * Replace the output of a run still in progress.
     *
     * @param runId The run ID
     * @param output The output collected so far
     */
    void updateOutput(long runId, String output);

    /**
     * Record the final state of a run.
     *
     * @param run The finished run
     */
    void finish(TaskRun run);

    /**
     * Find a run by ID.
     *
     * @param runId The run ID
     * @return The run if found
     */
    Optional<TaskRun> findById(long runId);

    /**
     * Find all runs of a task.
     *
     * @param taskId The task ID
     * @return Runs ordered by run ID
     */
    List<TaskRun> findByTask(long taskId);

    /**
     * Find the most recent run of a task.
     *
     * @param taskId The task ID
     * @return The latest run if any exists
     */
    Optional<TaskRun> findLatestByTask(long taskId);

    /**
     * Mark the open runs of a lost worker as LOST.
     *
     * @param workerId The lost worker
     * @param now Current time
     * @return Number of runs marked
     */
    int markLost(String workerId, Instant now);
}
