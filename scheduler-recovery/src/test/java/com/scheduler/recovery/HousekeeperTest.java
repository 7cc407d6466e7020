package com.scheduler.recovery;

import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.test.TimeController;
import com.scheduler.engine.metrics.SchedulerMetrics;
import com.scheduler.engine.persistence.InMemoryDependencyRepository;
import com.scheduler.engine.persistence.InMemoryTaskRepository;
import com.scheduler.engine.persistence.InMemoryTaskRunRepository;
import com.scheduler.engine.persistence.InMemoryWorkerRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class HousekeeperTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");
    private static final Duration STALE_THRESHOLD = Duration.ofSeconds(30);

    private TimeController clock;
    private InMemoryTaskRepository taskRepository;
    private InMemoryTaskRunRepository runRepository;
    private InMemoryWorkerRepository workerRepository;
    private SimpleMeterRegistry meterRegistry;
    private Housekeeper housekeeper;

    @BeforeEach
    void setUp() {
        clock = TimeController.frozenAt(T0);
        taskRepository = new InMemoryTaskRepository(new InMemoryDependencyRepository());
        runRepository = new InMemoryTaskRunRepository();
        workerRepository = new InMemoryWorkerRepository();
        meterRegistry = new SimpleMeterRegistry();
        SchedulerMetrics metrics = new SchedulerMetrics();
        metrics.bindTo(meterRegistry);
        housekeeper = new Housekeeper(taskRepository, runRepository, workerRepository,
            clock, STALE_THRESHOLD, metrics);
    }

    @Test
    @DisplayName("A crashed worker's running task is requeued and its run marked LOST")
    void recoversTasksOfLostWorker() {
        workerRepository.heartbeat("crashed", Set.of("main"), T0);
        ScheduledTask task = runningTask("nightly", "crashed");
        TaskRun run = runRepository.save(TaskRun.start(task.id(), "crashed", T0));

        clock.advanceSeconds(10);
        workerRepository.heartbeat("alive", Set.of("main"), clock.instant());
        clock.advanceSeconds(25);

        Housekeeper.SweepResult result = housekeeper.runOnce();

        assertThat(result.workersLost()).isEqualTo(1);
        assertThat(result.tasksRequeued()).isEqualTo(1);
        assertThat(result.runsLost()).isEqualTo(1);

        ScheduledTask recovered = taskRepository.findById(task.id()).orElseThrow();
        assertThat(recovered.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(recovered.assignedWorker()).isNull();
        assertThat(runRepository.findById(run.runId()).orElseThrow().status()).isEqualTo(RunStatus.LOST);
        assertThat(workerRepository.findById("crashed")).isEmpty();
        assertThat(workerRepository.findById("alive")).isPresent();
        assertThat(meterRegistry.counter("scheduler.recovery.tasks.reclaimed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repeating a sweep changes nothing")
    void sweepIsIdempotent() {
        workerRepository.heartbeat("crashed", Set.of("main"), T0);
        runningTask("nightly", "crashed");
        clock.advanceMinutes(5);

        assertThat(housekeeper.runOnce().isEmpty()).isFalse();
        assertThat(housekeeper.runOnce().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A worker exactly at the stale threshold is kept")
    void thresholdIsExclusive() {
        workerRepository.heartbeat("slow", Set.of("main"), T0);
        clock.advance(STALE_THRESHOLD);

        assertThat(housekeeper.runOnce().workersLost()).isZero();
        assertThat(workerRepository.findById("slow")).isPresent();
    }

    @Test
    @DisplayName("Queued tasks past their stop time expire")
    void expiresOverdueTasks() {
        ScheduledTask overdue = taskRepository.save(task("overdue").toBuilder()
            .stopTime(T0.plusSeconds(60))
            .build());
        clock.advanceMinutes(2);

        assertThat(housekeeper.runOnce().tasksExpired()).isEqualTo(1);
        assertThat(taskRepository.findById(overdue.id()).orElseThrow().status()).isEqualTo(TaskStatus.EXPIRED);
    }

    // ========== Helper Methods ==========

    private ScheduledTask runningTask(String uuid, String workerId) {
        ScheduledTask saved = taskRepository.save(task(uuid));
        ScheduledTask claimed = taskRepository.claim(saved.id(), workerId, T0).orElseThrow();
        taskRepository.markRunning(saved.id(), workerId, claimed.claimToken(), T0);
        return claimed;
    }

    private static ScheduledTask task(String uuid) {
        return ScheduledTask.builder()
            .uuid(uuid)
            .taskName(uuid)
            .functionName("demo.echo")
            .nextRunTime(T0)
            .createdAt(T0)
            .updatedAt(T0)
            .build();
    }
}
