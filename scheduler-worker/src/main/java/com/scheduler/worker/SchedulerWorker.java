package com.scheduler.worker;

import com.scheduler.core.graph.DependencyGraph;
import com.scheduler.core.model.DependencyEdge;
import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.repository.DependencyRepository;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.repository.TaskRunRepository;
import com.scheduler.core.repository.WorkerRepository;
import com.scheduler.core.schedule.RunResultPolicy;
import com.scheduler.core.schedule.RunTransition;
import com.scheduler.engine.logging.LoggingContext;
import com.scheduler.engine.metrics.SchedulerMetrics;
import com.scheduler.recovery.Housekeeper;
import com.scheduler.worker.execution.ExecutionMonitor;
import com.scheduler.worker.execution.ExecutionOutcome;
import com.scheduler.worker.execution.TaskExecutor;
import com.scheduler.worker.execution.TaskInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker loop: heartbeat, housekeeping, claim one due task, run it, report.
 *
 * Usage:
 * <pre>
 * SchedulerWorker worker = new SchedulerWorker(settings, taskRepository, runRepository,
 *     workerRepository, dependencyRepository, policy, executor, housekeeper, clock, metrics);
 * worker.start();
 * </pre>
 *
 * One task runs at a time. Other workers, in this or other processes, coordinate
 * only through conditional writes to the registry.
 */
public class SchedulerWorker {

    private static final Logger log = LoggerFactory.getLogger(SchedulerWorker.class);

    private final WorkerSettings settings;
    private final TaskRepository taskRepository;
    private final TaskRunRepository runRepository;
    private final WorkerRepository workerRepository;
    private final DependencyRepository dependencyRepository;
    private final RunResultPolicy resultPolicy;
    private final TaskExecutor executor;
    private final Housekeeper housekeeper;
    private final Clock clock;
    private final SchedulerMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService loopExecutor;

    private Instant lastHeartbeat;
    private Instant lastHousekeeping;
    private boolean releaseOwnedTasks = true;
    private boolean deregistered;
    private volatile WorkerStatus status = WorkerStatus.ACTIVE;

    public SchedulerWorker(
            WorkerSettings settings,
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            DependencyRepository dependencyRepository,
            RunResultPolicy resultPolicy,
            TaskExecutor executor,
            Housekeeper housekeeper,
            Clock clock,
            SchedulerMetrics metrics) {
        this.settings = settings;
        this.taskRepository = taskRepository;
        this.runRepository = runRepository;
        this.workerRepository = workerRepository;
        this.dependencyRepository = dependencyRepository;
        this.resultPolicy = resultPolicy;
        this.executor = executor;
        this.housekeeper = housekeeper;
        this.clock = clock;
        this.metrics = metrics;
        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "scheduler-worker");
            thread.setDaemon(false);
            return thread;
        });
    }

    public String getWorkerId() {
        return settings.workerId();
    }

    public WorkerStatus getStatus() {
        return status;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Start the worker loop on its own thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting worker {} for groups {}", settings.workerId(), settings.groupNames());
            loopExecutor.submit(this::loop);
        }
    }

    /**
     * Stop the worker gracefully. A running task is finished first.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker {}", settings.workerId());
        }
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker {} did not stop in time, interrupting", settings.workerId());
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one tick.
     *
     * @return true if a task was executed
     */
    public boolean runOnce() {
        if (status == WorkerStatus.TERMINATING) {
            deregister();
            return false;
        }
        try (LoggingContext ctx = LoggingContext.forWorker(settings.workerId())) {
            Instant now = clock.instant();

            heartbeatIfDue(now);
            if (status == WorkerStatus.TERMINATING) {
                deregister();
                return false;
            }
            if (status == WorkerStatus.DISABLED) {
                log.debug("Worker is disabled, not claiming");
                return false;
            }

            if (releaseOwnedTasks) {
                releaseOwnedTasks(now);
            }
            housekeepIfDue(now);
            return claimAndExecute(now);
        } catch (RuntimeException e) {
            // A tick that failed midway may have left a claim behind
            releaseOwnedTasks = true;
            throw e;
        }
    }

    // ========== Loop ==========

    private void loop() {
        while (running.get()) {
            try {
                boolean worked = runOnce();
                if (status == WorkerStatus.TERMINATING) {
                    log.info("Worker {} terminated by administrator", settings.workerId());
                    running.set(false);
                    break;
                }
                if (!worked) {
                    Thread.sleep(settings.pollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Error in worker loop", e);
                try {
                    Thread.sleep(settings.pollInterval().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        deregister();
    }

    private void heartbeatIfDue(Instant now) {
        if (lastHeartbeat != null
                && Duration.between(lastHeartbeat, now).compareTo(settings.heartbeatInterval()) < 0) {
            return;
        }
        WorkerRecord record = workerRepository.heartbeat(settings.workerId(), settings.groupNames(), now);
        lastHeartbeat = now;
        if (record.status() != status) {
            log.info("Worker status changed from {} to {}", status, record.status());
            status = record.status();
        }
    }

    /**
     * Between ticks this worker owns no task, so anything still assigned to it
     * was left behind by a failed tick or an earlier process with the same id.
     */
    private void releaseOwnedTasks(Instant now) {
        int requeued = taskRepository.requeueAbandoned(settings.workerId(), now);
        int lost = runRepository.markLost(settings.workerId(), now);
        releaseOwnedTasks = false;
        if (requeued > 0 || lost > 0) {
            log.warn("Released {} tasks and {} open runs left behind by this worker", requeued, lost);
        }
    }

    private void housekeepIfDue(Instant now) {
        if (lastHousekeeping != null
                && Duration.between(lastHousekeeping, now).compareTo(settings.housekeepingInterval()) < 0) {
            return;
        }
        lastHousekeeping = now;
        try {
            housekeeper.runOnce();
        } catch (RuntimeException e) {
            log.error("Housekeeping failed", e);
        }
    }

    private void deregister() {
        if (deregistered) {
            return;
        }
        try {
            releaseOwnedTasks(clock.instant());
            workerRepository.delete(settings.workerId());
            deregistered = true;
            log.info("Worker {} deregistered", settings.workerId());
        } catch (RuntimeException e) {
            log.error("Failed to deregister worker {}", settings.workerId(), e);
        }
    }

    // ========== Claim ==========

    private boolean claimAndExecute(Instant now) {
        List<ScheduledTask> due = taskRepository.findDue(settings.groupNames(), now, settings.batchSize());
        if (due.isEmpty()) {
            return false;
        }

        List<DependencyEdge> edges = dependencyRepository.findBySuccessors(
            due.stream().map(ScheduledTask::id).toList());
        DependencyGraph graph = DependencyGraph.fromEdges(edges);
        Set<Long> satisfied = new HashSet<>();

        for (ScheduledTask candidate : due) {
            satisfied.clear();
            edges.stream()
                .filter(edge -> edge.successorId() == candidate.id() && edge.satisfied())
                .forEach(edge -> satisfied.add(edge.predecessorId()));
            if (!graph.ready(candidate.id(), satisfied)) {
                log.debug("Task {} waits for predecessors {}", candidate.id(), graph.predecessors(candidate.id()));
                continue;
            }

            Optional<ScheduledTask> claimed = taskRepository.claim(candidate.id(), settings.workerId(), now);
            if (claimed.isEmpty()) {
                metrics.claimLost(candidate.groupName());
                log.debug("Lost claim of task {}", candidate.id());
                continue;
            }

            metrics.taskClaimed(candidate.groupName());
            execute(claimed.get());
            return true;
        }
        return false;
    }

    // ========== Execution ==========

    private void execute(ScheduledTask task) {
        try (LoggingContext ctx = LoggingContext.forTask(task.id(), task.uuid())) {
            Instant startedAt = clock.instant();
            if (!taskRepository.markRunning(task.id(), settings.workerId(), task.claimToken(), startedAt)) {
                log.info("Task was stopped or reassigned before it started");
                return;
            }
            ScheduledTask running = task.withRunning(startedAt);

            TaskRun run = runRepository.save(TaskRun.start(task.id(), settings.workerId(), startedAt));
            LoggingContext.setRunId(run.runId());
            log.info("Running task {} ({}), function {}", task.id(), task.uuid(), task.functionName());

            metrics.runStarted();
            ExecutionOutcome outcome = executor.execute(
                TaskInvocation.of(task, run.runId()),
                task.timeout(),
                task.syncOutputInterval(),
                new RunMonitor(running, run.runId()));
            Instant finishedAt = clock.instant();

            report(running, outcome, finishedAt);

            TaskRun finished = run.withFinished(outcome.status(), finishedAt,
                outcome.output(), outcome.result(), outcome.traceback());
            runRepository.finish(finished);
            metrics.runFinished(task.groupName(), outcome.status().name(), finished.duration());

            log.info("Task {} finished as {} in {} ms", task.id(), outcome.status(),
                finished.duration().toMillis());
        }
    }

    private void report(ScheduledTask task, ExecutionOutcome outcome, Instant finishedAt) {
        if (outcome.status() == RunStatus.STOPPED) {
            // Task row already changed by whoever stopped or reclaimed it
            return;
        }
        RunTransition transition = resultPolicy.decide(task, outcome.status(), finishedAt);
        boolean applied = taskRepository.applyTransition(
            task.id(), settings.workerId(), task.claimToken(), transition, finishedAt);

        if (!applied) {
            metrics.staleReport(task.groupName());
            return;
        }
        if (transition.isRequeued() && !transition.succeeded()) {
            metrics.taskRetried(task.groupName());
            log.info("Task {} failed, retry at {} ({} retries left)",
                task.id(), transition.nextRunTime(), transition.retryFailed());
        } else if (transition.isRequeued()) {
            log.debug("Task {} next runs at {}", task.id(), transition.nextRunTime());
        }
    }

    /**
     * Syncs output and checks whether the task is still ours while it runs.
     */
    private class RunMonitor implements ExecutionMonitor {

        private final ScheduledTask task;
        private final long runId;

        RunMonitor(ScheduledTask task, long runId) {
            this.task = task;
            this.runId = runId;
        }

        @Override
        public void onOutput(String output) {
            try {
                runRepository.updateOutput(runId, output);
            } catch (RuntimeException e) {
                log.warn("Could not sync output of run {}", runId, e);
            }
        }

        @Override
        public boolean shouldStop() {
            try {
                heartbeatIfDue(clock.instant());
                return taskRepository.findById(task.id())
                    .map(current -> current.status() != TaskStatus.RUNNING
                        || !settings.workerId().equals(current.assignedWorker())
                        || current.claimToken() != task.claimToken())
                    .orElse(true);
            } catch (RuntimeException e) {
                log.warn("Could not check task {}, letting it run", task.id(), e);
                return false;
            }
        }
    }
}
