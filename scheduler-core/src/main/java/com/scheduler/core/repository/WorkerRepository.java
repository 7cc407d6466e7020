package com.scheduler.core.repository;

import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for worker liveness records.
 */
public interface WorkerRepository {

    /**
     * Record a heartbeat, creating the worker if it is unknown.
     *
     * @param workerId The worker ID
     * @param groupNames Groups the worker serves
     * @param now Current time
     * @return The worker record after the heartbeat, carrying any administrative status change
     */
    WorkerRecord heartbeat(String workerId, Set<String> groupNames, Instant now);

    /**
     * Find a worker by ID.
     *
     * @param workerId The worker ID
     * @return The worker if found
     */
    Optional<WorkerRecord> findById(String workerId);

    /**
     * Find all registered workers.
     *
     * @return Workers ordered by ID
     */
    List<WorkerRecord> findAll();

    /**
     * Find workers whose last heartbeat is before the cutoff.
     *
     * @param cutoff Heartbeats older than this are stale
     * @return Stale workers
     */
    List<WorkerRecord> findStale(Instant cutoff);

    /**
     * Change the administrative status of a worker.
     *
     * @param workerId The worker ID
     * @param status The new status
     * @return true if the worker exists
     */
    boolean updateStatus(String workerId, WorkerStatus status);

    /**
     * Remove a worker.
     *
     * @param workerId The worker ID
     * @return true if a row was removed
     */
    boolean delete(String workerId);
}
