package com.scheduler.core.repository;

import com.scheduler.core.model.TaskStatus;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Criteria for task queries. Null criteria match everything.
 *
 * @param statuses Allowed statuses; empty matches all
 * @param groupName Exact group name
 * @param taskName Exact task name
 * @param nextRunBefore Only tasks with nextRunTime at or before this instant
 * @param limit Maximum number of results
 */
public record TaskFilter(
    Set<TaskStatus> statuses,
    String groupName,
    String taskName,
    Instant nextRunBefore,
    int limit
) {
    public static final int DEFAULT_LIMIT = 1000;

    public TaskFilter {
        statuses = statuses == null || statuses.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(statuses));
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static TaskFilter all() {
        return new TaskFilter(Set.of(), null, null, null, DEFAULT_LIMIT);
    }

    public static TaskFilter byStatus(TaskStatus... statuses) {
        return new TaskFilter(Set.of(statuses), null, null, null, DEFAULT_LIMIT);
    }

    public TaskFilter withGroupName(String group) {
        return new TaskFilter(statuses, group, taskName, nextRunBefore, limit);
    }

    public TaskFilter withTaskName(String name) {
        return new TaskFilter(statuses, groupName, name, nextRunBefore, limit);
    }

    public TaskFilter withNextRunBefore(Instant before) {
        return new TaskFilter(statuses, groupName, taskName, before, limit);
    }

    public TaskFilter withLimit(int newLimit) {
        return new TaskFilter(statuses, groupName, taskName, nextRunBefore, newLimit);
    }
}
