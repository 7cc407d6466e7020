package com.scheduler.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Liveness record of a worker process in the coordination store.
 * 
 * Primary Key: workerId
 * 
 * Invariants:
 * - lastHeartbeat >= firstHeartbeat
 * - groupNames is non-empty
 */
public record WorkerRecord(
    String workerId,
    Set<String> groupNames,
    Instant firstHeartbeat,
    Instant lastHeartbeat,
    WorkerStatus status
) {
    /**
     * Create a freshly started worker.
     */
    public static WorkerRecord create(String workerId, Set<String> groupNames, Instant now) {
        return new WorkerRecord(workerId, Set.copyOf(groupNames), now, now, WorkerStatus.ACTIVE);
    }

    /**
     * Check if the heartbeat is older than the staleness threshold.
     */
    public boolean isStale(Instant now, Duration threshold) {
        return lastHeartbeat.plus(threshold).isBefore(now);
    }

    /**
     * Create a copy with a new heartbeat time.
     */
    public WorkerRecord withHeartbeat(Instant now) {
        return new WorkerRecord(workerId, groupNames, firstHeartbeat, now, status);
    }

    /**
     * Create a copy with a new administrative status.
     */
    public WorkerRecord withStatus(WorkerStatus newStatus) {
        return new WorkerRecord(workerId, groupNames, firstHeartbeat, lastHeartbeat, newStatus);
    }

    /**
     * Check if the worker serves a task group.
     */
    public boolean serves(String groupName) {
        return groupNames.contains(groupName);
    }
}
