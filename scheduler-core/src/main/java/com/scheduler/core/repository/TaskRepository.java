package com.scheduler.core.repository;

import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.schedule.RunTransition;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ScheduledTask persistence.
 * Every state change a worker makes goes through a conditional update here.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task The task to save; its id is ignored
     * @return The task with its assigned id
     * @throws com.scheduler.core.exception.DuplicateTaskException if the uuid already exists
     */
    ScheduledTask save(ScheduledTask task);

    /**
     * Replace the definition of an existing task, keeping its id.
     *
     * @param task The task to update
     * @throws com.scheduler.core.exception.NotFoundException if the task does not exist
     */
    void update(ScheduledTask task);

    /**
     * Find a task by ID.
     *
     * @param id The task ID
     * @return The task if found
     */
    Optional<ScheduledTask> findById(long id);

    /**
     * Find a task by uuid.
     *
     * @param uuid The task uuid
     * @return The task if found
     */
    Optional<ScheduledTask> findByUuid(String uuid);

    /**
     * Find tasks matching a filter, ordered by id.
     *
     * @param filter The criteria
     * @return Matching tasks
     */
    List<ScheduledTask> find(TaskFilter filter);

    /**
     * Find QUEUED tasks of the given groups whose next run time has come.
     * Dependencies are not checked.
     *
     * @param groupNames Groups served by the caller
     * @param now Current time
     * @param limit Maximum number of results
     * @return Due tasks ordered by nextRunTime, then id
     */
    List<ScheduledTask> findDue(Collection<String> groupNames, Instant now, int limit);

    /**
     * Atomically claim a task for a worker.
     * Succeeds only if the task is QUEUED, due and has no unsatisfied incoming dependency.
     * Increments the claim token.
     *
     * @param taskId The task ID
     * @param workerId The claiming worker
     * @param now Current time
     * @return The claimed task, or empty if another worker won or the task is not claimable
     */
    Optional<ScheduledTask> claim(long taskId, String workerId, Instant now);

    /**
     * Move a claimed task to RUNNING.
     *
     * @param taskId The task ID
     * @param workerId The claiming worker
     * @param claimToken The token returned by the claim
     * @param now Current time
     * @return true if the caller still owns the task
     */
    boolean markRunning(long taskId, String workerId, long claimToken, Instant now);

    /**
     * Write back the outcome of a run.
     * On success also satisfies the dependency edges leaving the task and resets
     * the edges entering it whose predecessor is still scheduled.
     *
     * @param taskId The task ID
     * @param workerId The worker that ran the task
     * @param claimToken The token returned by the claim
     * @param transition The computed transition
     * @param now Current time
     * @return false if the report is stale (task stopped or reclaimed meanwhile)
     */
    boolean applyTransition(long taskId, String workerId, long claimToken,
                            RunTransition transition, Instant now);

    /**
     * Stop a task that is QUEUED, ASSIGNED or RUNNING.
     *
     * @param taskId The task ID
     * @param now Current time
     * @return true if the task was stopped by this call
     */
    boolean stop(long taskId, Instant now);

    /**
     * Hand tasks held by a worker back to the queue.
     *
     * @param workerId The lost worker
     * @param now Current time
     * @return Number of tasks requeued
     */
    int requeueAbandoned(String workerId, Instant now);

    /**
     * Mark QUEUED tasks whose stop time lies before now as EXPIRED.
     *
     * @param now Current time
     * @return Number of tasks expired
     */
    int expireOverdue(Instant now);
}
