package com.scheduler.recovery;

import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.repository.TaskRunRepository;
import com.scheduler.core.repository.WorkerRepository;
import com.scheduler.engine.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Cleans up after workers that stopped heartbeating and expires overdue tasks.
 *
 * Responsibilities:
 * - Detect workers whose last heartbeat is older than the stale threshold
 * - Requeue their ASSIGNED/RUNNING tasks and mark their open runs LOST
 * - Remove their worker rows
 * - Expire QUEUED tasks whose stop time has passed
 *
 * Every write is conditional, so any number of workers may run a sweep at the
 * same time and repeating a sweep changes nothing.
 */
public class Housekeeper {

    private static final Logger log = LoggerFactory.getLogger(Housekeeper.class);

    private final TaskRepository taskRepository;
    private final TaskRunRepository runRepository;
    private final WorkerRepository workerRepository;
    private final Clock clock;
    private final Duration staleThreshold;
    private final SchedulerMetrics metrics;

    public Housekeeper(
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            Clock clock,
            Duration staleThreshold,
            SchedulerMetrics metrics) {
        this.taskRepository = taskRepository;
        this.runRepository = runRepository;
        this.workerRepository = workerRepository;
        this.clock = clock;
        this.staleThreshold = staleThreshold;
        this.metrics = metrics;
    }

    /**
     * Run one sweep.
     *
     * @return What the sweep changed
     */
    public SweepResult runOnce() {
        Instant now = clock.instant();
        int workersLost = 0;
        int tasksRequeued = 0;
        int runsLost = 0;

        List<WorkerRecord> stale = workerRepository.findStale(now.minus(staleThreshold));
        for (WorkerRecord worker : stale) {
            try {
                int requeued = taskRepository.requeueAbandoned(worker.workerId(), now);
                int lost = runRepository.markLost(worker.workerId(), now);
                if (workerRepository.delete(worker.workerId())) {
                    workersLost++;
                    metrics.workerLost(requeued);
                }
                tasksRequeued += requeued;
                runsLost += lost;
                log.warn("Worker {} missed heartbeats since {}: requeued {} tasks, {} runs lost",
                    worker.workerId(), worker.lastHeartbeat(), requeued, lost);
            } catch (RuntimeException e) {
                log.error("Failed to recover tasks of worker {}", worker.workerId(), e);
            }
        }

        int expired = taskRepository.expireOverdue(now);
        if (expired > 0) {
            metrics.tasksExpired(expired);
            log.info("Expired {} queued tasks past their stop time", expired);
        }

        return new SweepResult(workersLost, tasksRequeued, runsLost, expired);
    }

    /**
     * Counts of one sweep.
     */
    public record SweepResult(int workersLost, int tasksRequeued, int runsLost, int tasksExpired) {

        public boolean isEmpty() {
            return workersLost == 0 && tasksRequeued == 0 && runsLost == 0 && tasksExpired == 0;
        }
    }
}
