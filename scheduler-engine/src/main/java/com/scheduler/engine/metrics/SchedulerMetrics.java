package com.scheduler.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the task scheduler.
 *
 * Metrics exposed:
 * - Tasks registered, claimed, lost claims and stale reports
 * - Run outcomes and durations per task group
 * - Retries
 * - Housekeeping: lost workers, reclaimed and expired tasks
 * - Busy gauge (1 while this process runs a task)
 *
 * Recording before {@link #bindTo(MeterRegistry)} is a no-op.
 */
public class SchedulerMetrics implements MeterBinder {

    // Metric names
    public static final String TASKS_QUEUED = "scheduler.tasks.queued";
    public static final String TASKS_CLAIMED = "scheduler.tasks.claimed";
    public static final String CLAIMS_LOST = "scheduler.claims.lost";
    public static final String RUNS = "scheduler.runs";
    public static final String RUN_DURATION = "scheduler.run.duration";
    public static final String RETRIES = "scheduler.task.retries";
    public static final String STALE_REPORTS = "scheduler.reports.stale";
    public static final String WORKERS_LOST = "scheduler.recovery.workers.lost";
    public static final String TASKS_RECLAIMED = "scheduler.recovery.tasks.reclaimed";
    public static final String TASKS_EXPIRED = "scheduler.recovery.tasks.expired";
    public static final String WORKER_BUSY = "scheduler.worker.busy";

    private volatile MeterRegistry registry;
    private final AtomicInteger busy = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(WORKER_BUSY, busy, AtomicInteger::get)
            .description("1 while this worker executes a task")
            .register(registry);
    }

    // ========== Registration Metrics ==========

    public void taskQueued(String group) {
        count(TASKS_QUEUED, "Tasks registered", "group", group);
    }

    // ========== Claim Metrics ==========

    public void taskClaimed(String group) {
        count(TASKS_CLAIMED, "Tasks claimed by this worker", "group", group);
    }

    public void claimLost(String group) {
        count(CLAIMS_LOST, "Claims lost to another worker", "group", group);
    }

    // ========== Run Metrics ==========

    public void runStarted() {
        busy.set(1);
    }

    public void runFinished(String group, String outcome, Duration duration) {
        busy.set(0);
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        String tag = outcome.toLowerCase(Locale.ROOT);
        Counter.builder(RUNS)
            .tag("group", group)
            .tag("outcome", tag)
            .description("Finished runs")
            .register(current)
            .increment();
        Timer.builder(RUN_DURATION)
            .tag("group", group)
            .tag("outcome", tag)
            .description("Run wall-clock duration")
            .register(current)
            .record(duration);
    }

    public void taskRetried(String group) {
        count(RETRIES, "Failed runs requeued for retry", "group", group);
    }

    public void staleReport(String group) {
        count(STALE_REPORTS, "Run results dropped because the claim was no longer current", "group", group);
    }

    // ========== Housekeeping Metrics ==========

    public void workerLost(int reclaimedTasks) {
        count(WORKERS_LOST, "Workers removed after missing heartbeats");
        increment(TASKS_RECLAIMED, "Tasks requeued from lost workers", reclaimedTasks);
    }

    public void tasksExpired(int expired) {
        increment(TASKS_EXPIRED, "Queued tasks expired past their stop time", expired);
    }

    // ========== Helper Methods ==========

    private void count(String name, String description, String... tags) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(name)
            .tags(tags)
            .description(description)
            .register(current)
            .increment();
    }

    private void increment(String name, String description, int amount) {
        MeterRegistry current = registry;
        if (current == null || amount <= 0) {
            return;
        }
        Counter.builder(name)
            .description(description)
            .register(current)
            .increment(amount);
    }
}
