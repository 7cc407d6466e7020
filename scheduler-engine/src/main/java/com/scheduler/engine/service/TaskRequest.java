package com.scheduler.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.scheduler.core.model.ScheduledTask;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Parameters of a task registration.
 *
 * At most one of {@code cronExpression} and {@code period} may be set; with neither
 * the task runs once. {@code dependsOn} lists task ids in {@code jobName} (defaults to
 * the group name) that must complete before this task may start.
 */
public record TaskRequest(
    String uuid,
    String taskName,
    String groupName,
    String functionName,
    JsonNode args,
    JsonNode kwargs,
    String cronExpression,
    Instant startTime,
    Instant stopTime,
    Duration period,
    boolean preventDrift,
    boolean immediate,
    int repeats,
    int retryFailed,
    Duration timeout,
    Duration syncOutputInterval,
    boolean overwrite,
    String jobName,
    List<Long> dependsOn
) {
    public TaskRequest {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    /**
     * Job the {@code dependsOn} edges are registered under.
     */
    public String effectiveJobName() {
        return jobName != null ? jobName : groupName;
    }

    public static Builder builder(String functionName) {
        return new Builder().functionName(functionName);
    }

    public static class Builder {
        private String uuid;
        private String taskName;
        private String groupName = ScheduledTask.DEFAULT_GROUP;
        private String functionName;
        private JsonNode args = JsonNodeFactory.instance.arrayNode();
        private JsonNode kwargs = JsonNodeFactory.instance.objectNode();
        private String cronExpression;
        private Instant startTime;
        private Instant stopTime;
        private Duration period;
        private boolean preventDrift = true;
        private boolean immediate;
        private int repeats = 1;
        private int retryFailed;
        private Duration timeout = ScheduledTask.DEFAULT_TIMEOUT;
        private Duration syncOutputInterval = Duration.ZERO;
        private boolean overwrite;
        private String jobName;
        private List<Long> dependsOn = List.of();

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

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
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

        public Builder retryFailed(int retryFailed) {
            this.retryFailed = retryFailed;
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

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder dependsOn(List<Long> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder dependsOn(Long... taskIds) {
            this.dependsOn = List.of(taskIds);
            return this;
        }

        public TaskRequest build() {
            return new TaskRequest(
                uuid, taskName, groupName, functionName, args, kwargs,
                cronExpression, startTime, stopTime, period, preventDrift, immediate,
                repeats, retryFailed, timeout, syncOutputInterval,
                overwrite, jobName, dependsOn
            );
        }
    }
}
