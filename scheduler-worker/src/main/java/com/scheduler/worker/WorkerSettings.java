package com.scheduler.worker;

import java.time.Duration;
import java.util.Set;

/**
 * Identity and timing of one worker process.
 *
 * @param workerId Unique among live workers, e.g. {@code host#pid}
 * @param groupNames Task groups this worker claims from
 * @param pollInterval Pause after a tick that found nothing to run, and after an error
 * @param heartbeatInterval How often the worker writes its heartbeat
 * @param housekeepingInterval How often the worker sweeps for lost workers and overdue tasks
 * @param batchSize Due tasks fetched per poll
 */
public record WorkerSettings(
    String workerId,
    Set<String> groupNames,
    Duration pollInterval,
    Duration heartbeatInterval,
    Duration housekeepingInterval,
    int batchSize
) {
    public WorkerSettings {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (groupNames == null || groupNames.isEmpty()) {
            throw new IllegalArgumentException("A worker must serve at least one group");
        }
        for (String group : groupNames) {
            if (group == null || group.isBlank() || group.contains(",")) {
                throw new IllegalArgumentException("Invalid group name '" + group + "'");
            }
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        groupNames = Set.copyOf(groupNames);
    }

    public static WorkerSettings defaults(String workerId, Set<String> groupNames) {
        return new WorkerSettings(workerId, groupNames,
            Duration.ofSeconds(3), Duration.ofSeconds(3), Duration.ofSeconds(30), 10);
    }
}
