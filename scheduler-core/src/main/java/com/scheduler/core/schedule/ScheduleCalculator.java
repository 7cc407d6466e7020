package com.scheduler.core.schedule;

import com.scheduler.core.cron.CronExpression;
import com.scheduler.core.model.ScheduledTask;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes fire times for tasks.
 *
 * Cron fields are evaluated in a fixed zone; periodic and one-shot schedules
 * are plain instant arithmetic.
 */
public class ScheduleCalculator {

    private final ZoneId zone;
    private final Map<String, CronExpression> cronCache = new ConcurrentHashMap<>();

    public ScheduleCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * When a newly registered task first becomes due.
     */
    public Instant firstRunTime(ScheduledTask task, Instant now) {
        if (task.immediate()) {
            return now;
        }
        return switch (task.scheduleType()) {
            case CRON -> {
                CronExpression cron = cron(task.cronExpression());
                if (task.startTime() == null || !task.startTime().isAfter(now)) {
                    yield cron.next(now, zone);
                }
                // A start time that is itself a fire time counts
                yield cron.next(task.startTime().minusSeconds(1), zone);
            }
            case PERIODIC, ONE_SHOT -> task.startTime() != null ? task.startTime() : now;
        };
    }

    /**
     * When a task is next due after a run finished, or null for one-shot tasks.
     *
     * Drift-prevented periodic tasks stay on the grid {@code startTime + N * period}:
     * the result is the first grid point after both the previous fire time and the
     * finish time. Drift-following tasks fire {@code period} after the finish time.
     */
    public Instant nextRunTime(ScheduledTask task, Instant finishedAt) {
        return switch (task.scheduleType()) {
            case CRON -> cron(task.cronExpression()).next(finishedAt, zone);
            case PERIODIC -> task.preventDrift()
                ? nextOnGrid(anchor(task), task.period(), latest(task.nextRunTime(), finishedAt))
                : finishedAt.plus(task.period());
            case ONE_SHOT -> null;
        };
    }

    /**
     * Parse a cron expression, reusing earlier parses.
     */
    public CronExpression cron(String expression) {
        return cronCache.computeIfAbsent(expression, CronExpression::parse);
    }

    // ========== Helper Methods ==========

    private static Instant anchor(ScheduledTask task) {
        if (task.startTime() != null) {
            return task.startTime();
        }
        return task.createdAt() != null ? task.createdAt() : task.nextRunTime();
    }

    /**
     * Smallest {@code anchor + N * period} strictly after {@code after}, N >= 0.
     */
    static Instant nextOnGrid(Instant anchor, Duration period, Instant after) {
        if (after.isBefore(anchor)) {
            return anchor;
        }
        long periodMillis = Math.max(1, period.toMillis());
        long elapsed = Duration.between(anchor, after).toMillis();
        long steps = elapsed / periodMillis + 1;
        return anchor.plusMillis(steps * periodMillis);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return a.isAfter(b) ? a : b;
    }
}
