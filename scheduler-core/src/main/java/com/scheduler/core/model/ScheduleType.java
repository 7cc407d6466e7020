package com.scheduler.core.model;

/**
 * How a task's fire times are derived.
 */
public enum ScheduleType {
    /**
     * Fire times come from a cron expression.
     */
    CRON,

    /**
     * Fixed interval from start time.
     */
    PERIODIC,

    /**
     * Single run at start time.
     */
    ONE_SHOT
}
