package com.scheduler.worker;

import com.fasterxml.jackson.databind.node.IntNode;
import com.scheduler.core.model.DependencyEdge;
import com.scheduler.core.model.RetryPolicy;
import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.schedule.RunResultPolicy;
import com.scheduler.core.schedule.ScheduleCalculator;
import com.scheduler.core.test.TimeController;
import com.scheduler.engine.coordinator.TaskRegistry;
import com.scheduler.engine.metrics.SchedulerMetrics;
import com.scheduler.engine.persistence.InMemoryDependencyRepository;
import com.scheduler.engine.persistence.InMemoryTaskRepository;
import com.scheduler.engine.persistence.InMemoryTaskRunRepository;
import com.scheduler.engine.persistence.InMemoryWorkerRepository;
import com.scheduler.engine.service.TaskRequest;
import com.scheduler.recovery.Housekeeper;
import com.scheduler.worker.execution.ExecutionOutcome;
import com.scheduler.worker.execution.TaskExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class SchedulerWorkerTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private TimeController clock;
    private InMemoryTaskRepository taskRepository;
    private InMemoryTaskRunRepository runRepository;
    private InMemoryWorkerRepository workerRepository;
    private InMemoryDependencyRepository dependencyRepository;
    private SimpleMeterRegistry meterRegistry;
    private SchedulerMetrics metrics;
    private TaskRegistry registry;

    private TaskExecutor behaviour;
    private final List<String> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = TimeController.frozenAt(T0);
        dependencyRepository = new InMemoryDependencyRepository();
        taskRepository = new InMemoryTaskRepository(dependencyRepository);
        runRepository = new InMemoryTaskRunRepository();
        workerRepository = new InMemoryWorkerRepository();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics();
        metrics.bindTo(meterRegistry);
        registry = new TaskRegistry(taskRepository, runRepository, workerRepository, dependencyRepository,
            new ScheduleCalculator(ZoneOffset.UTC), clock, metrics);
        behaviour = (invocation, timeout, sync, monitor) -> {
            clock.advanceSeconds(5);
            return ExecutionOutcome.completed("ok", IntNode.valueOf(42));
        };
    }

    // ========== Running ==========

    @Test
    @DisplayName("A due periodic task is run, recorded and requeued at its next slot")
    void runOnce_periodicTask() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("every-minute")
            .period(Duration.ofMinutes(1)).immediate(true).repeats(3));
        SchedulerWorker worker = worker("w1");

        assertThat(worker.runOnce()).isTrue();

        ScheduledTask task = taskRepository.findById(id).orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.timesRun()).isEqualTo(1);
        assertThat(task.repeats()).isEqualTo(2);
        assertThat(task.nextRunTime()).isEqualTo(T0.plusSeconds(60));
        assertThat(task.assignedWorker()).isNull();

        TaskRun run = runRepository.findLatestByTask(id).orElseThrow();
        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.workerId()).isEqualTo("w1");
        assertThat(run.output()).isEqualTo("ok");
        assertThat(run.result().asInt()).isEqualTo(42);
        assertThat(run.stopTime()).isEqualTo(T0.plusSeconds(5));
        assertThat(meterRegistry.counter("scheduler.tasks.claimed", "group", "main").count()).isEqualTo(1.0);

        assertThat(worker.runOnce()).isFalse();
        clock.advanceSeconds(55);
        assertThat(worker.runOnce()).isTrue();
        assertThat(runRepository.findByTask(id)).hasSize(2);
    }

    @Test
    @DisplayName("A failed run is retried while budget remains, then the task fails")
    void runOnce_retriesThenFails() {
        long id = queue(TaskRequest.builder("demo.fail").uuid("flaky").immediate(true).retryFailed(1));
        behaviour = (invocation, timeout, sync, monitor) -> ExecutionOutcome.failed("partial", "boom");
        SchedulerWorker worker = worker("w1");

        assertThat(worker.runOnce()).isTrue();
        ScheduledTask afterFirst = taskRepository.findById(id).orElseThrow();
        assertThat(afterFirst.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(afterFirst.retryFailed()).isZero();
        assertThat(afterFirst.timesFailed()).isEqualTo(1);

        assertThat(worker.runOnce()).isTrue();
        ScheduledTask afterSecond = taskRepository.findById(id).orElseThrow();
        assertThat(afterSecond.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(afterSecond.timesFailed()).isEqualTo(2);

        assertThat(runRepository.findByTask(id))
            .extracting(TaskRun::status, TaskRun::traceback)
            .containsExactly(tuple(RunStatus.FAILED, "boom"), tuple(RunStatus.FAILED, "boom"));
        assertThat(meterRegistry.counter("scheduler.task.retries", "group", "main").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A task is run by only one of two workers")
    void runOnce_oneWorkerPerTask() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("once").immediate(true));
        SchedulerWorker first = worker("w1");
        SchedulerWorker second = worker("w2");

        assertThat(first.runOnce()).isTrue();
        assertThat(second.runOnce()).isFalse();

        assertThat(runRepository.findByTask(id)).hasSize(1);
        assertThat(taskRepository.findById(id).orElseThrow().status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("Workers only claim tasks of their own groups")
    void runOnce_groupScoped() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("reports").groupName("reports").immediate(true));

        assertThat(worker("w1").runOnce()).isFalse();
        assertThat(taskRepository.findById(id).orElseThrow().status()).isEqualTo(TaskStatus.QUEUED);
    }

    @Test
    @DisplayName("Output synced while running is visible before the run ends")
    void runOnce_syncsOutput() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("progress").immediate(true)
            .syncOutputInterval(Duration.ofSeconds(1)));
        AtomicReference<String> seenWhileRunning = new AtomicReference<>();
        behaviour = (invocation, timeout, sync, monitor) -> {
            assertThat(sync).isEqualTo(Duration.ofSeconds(1));
            monitor.onOutput("50%");
            seenWhileRunning.set(runRepository.findById(invocation.runId()).orElseThrow().output());
            return ExecutionOutcome.completed("100%", null);
        };

        worker("w1").runOnce();

        assertThat(seenWhileRunning.get()).isEqualTo("50%");
        assertThat(runRepository.findLatestByTask(id).orElseThrow().output()).isEqualTo("100%");
    }

    // ========== Stop and Stale Reports ==========

    @Test
    @DisplayName("A task stopped while running ends with a STOPPED run")
    void runOnce_stoppedWhileRunning() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("long").immediate(true));
        behaviour = (invocation, timeout, sync, monitor) -> {
            assertThat(monitor.shouldStop()).isFalse();
            registry.stopTask(invocation.taskId());
            return monitor.shouldStop()
                ? ExecutionOutcome.stopped("", "stopped")
                : ExecutionOutcome.completed("", null);
        };

        worker("w1").runOnce();

        assertThat(taskRepository.findById(id).orElseThrow().status()).isEqualTo(TaskStatus.STOPPED);
        assertThat(runRepository.findLatestByTask(id).orElseThrow().status()).isEqualTo(RunStatus.STOPPED);
    }

    @Test
    @DisplayName("A report for a task reclaimed meanwhile is dropped")
    void runOnce_staleReportDropped() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("reclaimed").immediate(true));
        behaviour = (invocation, timeout, sync, monitor) -> {
            taskRepository.requeueAbandoned("w1", clock.instant());
            return ExecutionOutcome.completed("late", null);
        };

        worker("w1").runOnce();

        ScheduledTask task = taskRepository.findById(id).orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.timesRun()).isZero();
        assertThat(meterRegistry.counter("scheduler.reports.stale", "group", "main").count()).isEqualTo(1.0);
    }

    // ========== Dependencies ==========

    @Test
    @DisplayName("A successor waits until its predecessor completed")
    void runOnce_dependencyGate() {
        long report = queue(TaskRequest.builder("demo.echo").uuid("report").immediate(true));
        long extract = queue(TaskRequest.builder("demo.echo").uuid("extract").immediate(true));
        registry.addDependencies("nightly", List.of(DependencyEdge.of("nightly", extract, report)));
        behaviour = (invocation, timeout, sync, monitor) -> {
            executed.add(invocation.taskUuid());
            return ExecutionOutcome.completed("", null);
        };
        SchedulerWorker worker = worker("w1");

        assertThat(worker.runOnce()).isTrue();
        assertThat(worker.runOnce()).isTrue();
        assertThat(worker.runOnce()).isFalse();

        assertThat(executed).containsExactly("extract", "report");
        assertThat(taskRepository.findById(report).orElseThrow().status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("A successor of a failed predecessor never runs")
    void runOnce_failedPredecessorBlocks() {
        long report = queue(TaskRequest.builder("demo.echo").uuid("report").immediate(true));
        long extract = queue(TaskRequest.builder("demo.fail").uuid("extract").immediate(true));
        registry.addDependencies("nightly", List.of(DependencyEdge.of("nightly", extract, report)));
        behaviour = (invocation, timeout, sync, monitor) -> ExecutionOutcome.failed("", "boom");
        SchedulerWorker worker = worker("w1");

        assertThat(worker.runOnce()).isTrue();
        assertThat(worker.runOnce()).isFalse();

        assertThat(taskRepository.findById(report).orElseThrow().status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(runRepository.findByTask(report)).isEmpty();
    }

    // ========== Worker Administration ==========

    @Test
    @DisplayName("A disabled worker keeps its heartbeat but claims nothing")
    void runOnce_disabled() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("waiting").immediate(true));
        workerRepository.heartbeat("w1", Set.of("main"), T0);
        workerRepository.updateStatus("w1", WorkerStatus.DISABLED);
        SchedulerWorker worker = worker("w1");

        assertThat(worker.runOnce()).isFalse();

        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.DISABLED);
        assertThat(taskRepository.findById(id).orElseThrow().status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(workerRepository.findById("w1")).isPresent();
    }

    @Test
    @DisplayName("A worker set to TERMINATING deregisters itself")
    void runOnce_terminating() {
        queue(TaskRequest.builder("demo.echo").uuid("waiting").immediate(true));
        SchedulerWorker worker = worker("w1");
        assertThat(worker.runOnce()).isTrue();

        registry.setWorkerStatus("w1", WorkerStatus.TERMINATING);
        clock.advanceSeconds(10);

        assertThat(worker.runOnce()).isFalse();
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.TERMINATING);
        assertThat(workerRepository.findById("w1")).isEmpty();
    }

    // ========== Recovery ==========

    @Test
    @DisplayName("A task held by a crashed worker is recovered and run by another")
    void runOnce_recoversLostWorker() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("orphan").immediate(true));
        workerRepository.heartbeat("crashed", Set.of("main"), T0);
        ScheduledTask claimed = taskRepository.claim(id, "crashed", T0).orElseThrow();
        taskRepository.markRunning(id, "crashed", claimed.claimToken(), T0);
        runRepository.save(TaskRun.start(id, "crashed", T0));

        clock.advanceSeconds(60);
        assertThat(worker("w1").runOnce()).isTrue();

        assertThat(workerRepository.findById("crashed")).isEmpty();
        assertThat(runRepository.findByTask(id))
            .extracting(TaskRun::workerId, TaskRun::status)
            .containsExactly(tuple("crashed", RunStatus.LOST), tuple("w1", RunStatus.COMPLETED));
        assertThat(taskRepository.findById(id).orElseThrow().status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("Claims left behind under the worker's own id are released at startup")
    void runOnce_releasesOwnOrphans() {
        long id = queue(TaskRequest.builder("demo.echo").uuid("restart").immediate(true));
        taskRepository.claim(id, "w1", T0).orElseThrow();

        assertThat(worker("w1").runOnce()).isTrue();

        assertThat(taskRepository.findById(id).orElseThrow().status()).isEqualTo(TaskStatus.COMPLETED);
    }

    // ========== Helper Methods ==========

    private long queue(TaskRequest.Builder request) {
        return registry.queueTask(request.build()).id();
    }

    private SchedulerWorker worker(String workerId) {
        WorkerSettings settings = new WorkerSettings(workerId, Set.of("main"),
            Duration.ofMillis(10), Duration.ofSeconds(3), Duration.ofSeconds(30), 10);
        ScheduleCalculator calculator = new ScheduleCalculator(ZoneOffset.UTC);
        Housekeeper housekeeper = new Housekeeper(taskRepository, runRepository, workerRepository,
            clock, Duration.ofSeconds(30), metrics);
        return new SchedulerWorker(settings, taskRepository, runRepository, workerRepository,
            dependencyRepository, new RunResultPolicy(calculator, RetryPolicy.immediate()),
            (invocation, timeout, sync, monitor) -> behaviour.execute(invocation, timeout, sync, monitor),
            housekeeper, clock, metrics);
    }
}
