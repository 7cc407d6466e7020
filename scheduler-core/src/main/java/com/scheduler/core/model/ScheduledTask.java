package com.scheduler.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;
import java.time.Instant;

/**
 * A unit of scheduled work as stored in the task registry.
 *
 * Primary Key: id
 * Unique Constraint: uuid
 *
 * Invariants:
 * - assignedWorker set iff status is ASSIGNED or RUNNING
 * - at most one of cronExpression and period is set
 * - repeats, timesRun, retryFailed, timesFailed are never negative
 * - claimToken increases on every claim
 */
public record ScheduledTask(
    // Identity
    Long id,
    String uuid,
    String taskName,
    String groupName,

    // Payload
    String functionName,
    JsonNode args,
    JsonNode kwargs,

    // State
    TaskStatus status,

    // Schedule
    String cronExpression,
    Instant startTime,
    Instant nextRunTime,
    Instant stopTime,
    Duration period,
    boolean preventDrift,
    boolean immediate,

    // Budgets and counters
    int repeats,
    int timesRun,
    int retryFailed,
    int timesFailed,

    // Execution
    Duration timeout,
    Duration syncOutputInterval,

    // Ownership (fencing)
    String assignedWorker,
    long claimToken,

    // Timing
    Instant lastRunTime,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String DEFAULT_GROUP = "main";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    /**
     * How fire times are derived for this task.
     */
    public ScheduleType scheduleType() {
        if (cronExpression != null) {
            return ScheduleType.CRON;
        }
        if (period != null) {
            return ScheduleType.PERIODIC;
        }
        return ScheduleType.ONE_SHOT;
    }

    /**
     * Claim priority: the earliest due task goes first.
     */
    public Instant priority() {
        return nextRunTime;
    }

    /**
     * {@code repeats == 0} means run until stop time.
     */
    public boolean hasUnlimitedRepeats() {
        return repeats == 0;
    }

    /**
     * Check if the task may be claimed at the given time (dependencies aside).
     */
    public boolean isDue(Instant now) {
        return status == TaskStatus.QUEUED && !nextRunTime.isAfter(now);
    }

    /**
     * Check if the stop time lies strictly before the given time.
     */
    public boolean isPastStopTime(Instant now) {
        return stopTime != null && stopTime.isBefore(now);
    }

    /**
     * Create a copy claimed by a worker.
     */
    public ScheduledTask withAssigned(String workerId, Instant now) {
        return toBuilder()
            .status(TaskStatus.ASSIGNED)
            .assignedWorker(workerId)
            .claimToken(claimToken + 1)
            .updatedAt(now)
            .build();
    }

    /**
     * Create a copy dispatched to a child process.
     */
    public ScheduledTask withRunning(Instant now) {
        return toBuilder()
            .status(TaskStatus.RUNNING)
            .lastRunTime(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Create a copy handed back to the queue after its worker was lost.
     */
    public ScheduledTask withReclaimed(Instant now) {
        return toBuilder()
            .status(TaskStatus.QUEUED)
            .assignedWorker(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Create a copy in a new status, releasing worker ownership when the status is not active.
     */
    public ScheduledTask withStatus(TaskStatus newStatus, Instant now) {
        return toBuilder()
            .status(newStatus)
            .assignedWorker(newStatus.isActive() ? assignedWorker : null)
            .updatedAt(now)
            .build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .uuid(uuid)
            .taskName(taskName)
            .groupName(groupName)
            .functionName(functionName)
            .args(args)
            .kwargs(kwargs)
            .status(status)
            .cronExpression(cronExpression)
            .startTime(startTime)
            .nextRunTime(nextRunTime)
            .stopTime(stopTime)
            .period(period)
            .preventDrift(preventDrift)
            .immediate(immediate)
            .repeats(repeats)
            .timesRun(timesRun)
            .retryFailed(retryFailed)
            .timesFailed(timesFailed)
            .timeout(timeout)
            .syncOutputInterval(syncOutputInterval)
            .assignedWorker(assignedWorker)
            .claimToken(claimToken)
            .lastRunTime(lastRunTime)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    /**
     * Builder for ScheduledTask.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long id;
        private String uuid;
        private String taskName;
        private String groupName = DEFAULT_GROUP;
        private String functionName;
        private JsonNode args = JsonNodeFactory.instance.arrayNode();
        private JsonNode kwargs = JsonNodeFactory.instance.objectNode();
        private TaskStatus status = TaskStatus.QUEUED;
        private String cronExpression;
        private Instant startTime;
        private Instant nextRunTime;
        private Instant stopTime;
        private Duration period;
        private boolean preventDrift;
        private boolean immediate;
        private int repeats = 1;
        private int timesRun;
        private int retryFailed;
        private int timesFailed;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration syncOutputInterval = Duration.ZERO;
        private String assignedWorker;
        private long claimToken;
        private Instant lastRunTime;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder uuid(String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder groupName(String groupName) {
            this.groupName = groupName;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder args(JsonNode args) {
            this.args = args;
            return this;
        }

        public Builder kwargs(JsonNode kwargs) {
            this.kwargs = kwargs;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder nextRunTime(Instant nextRunTime) {
            this.nextRunTime = nextRunTime;
            return this;
        }

        public Builder stopTime(Instant stopTime) {
            this.stopTime = stopTime;
            return this;
        }

        public Builder period(Duration period) {
            this.period = period;
            return this;
        }

        public Builder preventDrift(boolean preventDrift) {
            this.preventDrift = preventDrift;
            return this;
        }

        public Builder immediate(boolean immediate) {
            this.immediate = immediate;
            return this;
        }

        public Builder repeats(int repeats) {
            this.repeats = repeats;
            return this;
        }

        public Builder timesRun(int timesRun) {
            this.timesRun = timesRun;
            return this;
        }

        public Builder retryFailed(int retryFailed) {
            this.retryFailed = retryFailed;
            return this;
        }

        public Builder timesFailed(int timesFailed) {
            this.timesFailed = timesFailed;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder syncOutputInterval(Duration syncOutputInterval) {
            this.syncOutputInterval = syncOutputInterval;
            return this;
        }

        public Builder assignedWorker(String assignedWorker) {
            this.assignedWorker = assignedWorker;
            return this;
        }

        public Builder claimToken(long claimToken) {
            this.claimToken = claimToken;
            return this;
        }

        public Builder lastRunTime(Instant lastRunTime) {
            this.lastRunTime = lastRunTime;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ScheduledTask build() {
            return new ScheduledTask(
                id, uuid, taskName, groupName, functionName, args, kwargs, status,
                cronExpression, startTime, nextRunTime, stopTime, period, preventDrift, immediate,
                repeats, timesRun, retryFailed, timesFailed, timeout, syncOutputInterval,
                assignedWorker, claimToken, lastRunTime, createdAt, updatedAt
            );
        }
    }
}
