package com.scheduler.app.health;

import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.repository.TaskFilter;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.repository.WorkerRepository;
import com.scheduler.worker.SchedulerWorker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports this process's worker and the registry it coordinates through.
 *
 * DOWN when the registry cannot be read. OUT_OF_SERVICE when the worker is
 * terminating or its loop is not running.
 */
@Component
public class SchedulerHealthIndicator implements HealthIndicator {

    private final SchedulerWorker worker;
    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final Clock clock;

    public SchedulerHealthIndicator(
            SchedulerWorker worker,
            WorkerRepository workerRepository,
            TaskRepository taskRepository,
            Clock clock) {
        this.worker = worker;
        this.workerRepository = workerRepository;
        this.taskRepository = taskRepository;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("workerId", worker.getWorkerId());
        details.put("workerStatus", worker.getStatus().name());
        details.put("loopRunning", worker.isRunning());

        try {
            List<WorkerRecord> workers = workerRepository.findAll();
            details.put("registeredWorkers", workers.size());
            workers.stream()
                .filter(record -> record.workerId().equals(worker.getWorkerId()))
                .findFirst()
                .ifPresent(record -> details.put("lastHeartbeatAgeMs",
                    Duration.between(record.lastHeartbeat(), Instant.now(clock)).toMillis()));

            details.put("activeTasks", taskRepository.find(
                TaskFilter.byStatus(TaskStatus.ASSIGNED, TaskStatus.RUNNING)).size());
            details.put("dueTasks", taskRepository.find(
                TaskFilter.byStatus(TaskStatus.QUEUED).withNextRunBefore(Instant.now(clock))).size());
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }

        if (worker.getStatus() == WorkerStatus.TERMINATING || !worker.isRunning()) {
            return Health.outOfService()
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }
}
