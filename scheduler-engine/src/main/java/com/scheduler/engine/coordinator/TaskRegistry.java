package com.scheduler.engine.coordinator;

import com.scheduler.core.cron.CronParseException;
import com.scheduler.core.exception.CyclicDependencyException;
import com.scheduler.core.exception.DuplicateTaskException;
import com.scheduler.core.exception.NotFoundException;
import com.scheduler.core.exception.TaskValidationException;
import com.scheduler.core.graph.DependencyGraph;
import com.scheduler.core.model.DependencyEdge;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.repository.DependencyRepository;
import com.scheduler.core.repository.TaskFilter;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.repository.TaskRunRepository;
import com.scheduler.core.repository.WorkerRepository;
import com.scheduler.core.schedule.ScheduleCalculator;
import com.scheduler.engine.metrics.SchedulerMetrics;
import com.scheduler.engine.service.SchedulerService;
import com.scheduler.engine.service.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Registration side of the scheduler: validates and stores task definitions and
 * their dependencies, answers status queries and relays administrative commands
 * to workers through the registry.
 *
 * Nothing here executes tasks; workers pick stored tasks up on their next poll.
 */
public class TaskRegistry implements SchedulerService {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    static final Duration MIN_PERIOD = Duration.ofSeconds(1);

    private final TaskRepository taskRepository;
    private final TaskRunRepository runRepository;
    private final WorkerRepository workerRepository;
    private final DependencyRepository dependencyRepository;
    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final SchedulerMetrics metrics;
    private final Predicate<String> functionCatalog;

    public TaskRegistry(
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            DependencyRepository dependencyRepository,
            ScheduleCalculator calculator,
            Clock clock,
            SchedulerMetrics metrics) {
        this(taskRepository, runRepository, workerRepository, dependencyRepository,
            calculator, clock, metrics, name -> true);
    }

    /**
     * @param functionCatalog Accepts the function names workers can run
     */
    public TaskRegistry(
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            DependencyRepository dependencyRepository,
            ScheduleCalculator calculator,
            Clock clock,
            SchedulerMetrics metrics,
            Predicate<String> functionCatalog) {
        this.taskRepository = taskRepository;
        this.runRepository = runRepository;
        this.workerRepository = workerRepository;
        this.dependencyRepository = dependencyRepository;
        this.calculator = calculator;
        this.clock = clock;
        this.metrics = metrics;
        this.functionCatalog = functionCatalog;
    }

    // ========== Registration ==========

    @Override
    @Transactional
    public QueueResult queueTask(TaskRequest request) {
        Instant now = clock.instant();
        String uuid = request.uuid() != null ? request.uuid() : UUID.randomUUID().toString();

        Map<String, String> errors = validate(request, now);

        Optional<ScheduledTask> existing = taskRepository.findByUuid(uuid);
        if (existing.isPresent()) {
            if (!request.overwrite()) {
                errors.put("uuid", "task " + existing.get().id() + " already uses uuid '" + uuid + "'");
            } else if (existing.get().status().isActive()) {
                errors.put("uuid", "task '" + uuid + "' is " + existing.get().status()
                    + "; stop it before overwriting");
            }
        }

        Map<Long, ScheduledTask> predecessors = new LinkedHashMap<>();
        for (Long predecessorId : request.dependsOn()) {
            Optional<ScheduledTask> predecessor = taskRepository.findById(predecessorId);
            if (predecessor.isEmpty()) {
                errors.merge("dependencies", "unknown task " + predecessorId, (a, b) -> a + "; " + b);
            } else {
                predecessors.put(predecessorId, predecessor.get());
            }
        }

        String jobName = request.effectiveJobName();
        if (errors.isEmpty() && existing.isPresent() && !predecessors.isEmpty()) {
            // Only an existing task can have successors, so only then can new edges close a cycle
            try {
                checkAcyclic(jobName, existing.get().id(), predecessors.keySet());
            } catch (CyclicDependencyException | TaskValidationException e) {
                errors.put("dependencies", e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            log.info("Rejected task registration: uuid={}, errors={}", uuid, errors);
            return QueueResult.rejected(uuid, errors);
        }

        ScheduledTask stored;
        try {
            stored = existing.isPresent()
                ? replace(existing.get(), request, now)
                : taskRepository.save(toTask(request, uuid, now));
        } catch (DuplicateTaskException e) {
            return QueueResult.rejected(uuid, Map.of("uuid", e.getMessage()));
        }

        if (!predecessors.isEmpty()) {
            saveNewEdges(jobName, stored.id(), predecessors);
        }

        metrics.taskQueued(stored.groupName());
        log.info("Queued task: id={}, uuid={}, function={}, group={}, nextRun={}",
            stored.id(), stored.uuid(), stored.functionName(), stored.groupName(), stored.nextRunTime());

        return QueueResult.accepted(stored.id(), stored.uuid());
    }

    @Override
    @Transactional
    public void addDependencies(String jobName, Collection<DependencyEdge> edges) {
        Set<Long> taskIds = new HashSet<>();
        for (DependencyEdge edge : edges) {
            taskIds.add(edge.predecessorId());
            taskIds.add(edge.successorId());
        }

        Map<Long, ScheduledTask> tasks = new LinkedHashMap<>();
        for (Long taskId : taskIds) {
            ScheduledTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskValidationException("dependencies", "unknown task " + taskId));
            tasks.put(taskId, task);
        }

        DependencyGraph graph = DependencyGraph.fromEdges(dependencyRepository.findAll());
        graph.addEdges(jobName, taskIds, edges);

        List<DependencyEdge> toSave = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        dependencyRepository.findByJob(jobName).forEach(edge -> seen.add(key(edge)));
        for (DependencyEdge edge : edges) {
            if (seen.add(key(edge))) {
                toSave.add(edge.withSatisfied(isSatisfied(tasks.get(edge.predecessorId()))));
            }
        }
        dependencyRepository.saveAll(toSave);

        log.info("Added {} dependencies to job {}", toSave.size(), jobName);
    }

    // ========== Status Queries ==========

    @Override
    public List<TaskStatusView> taskStatus(long taskId, boolean includeOutput) {
        return taskRepository.findById(taskId)
            .map(task -> List.of(view(task, includeOutput)))
            .orElse(List.of());
    }

    @Override
    public List<TaskStatusView> taskStatus(String uuid, boolean includeOutput) {
        return taskRepository.findByUuid(uuid)
            .map(task -> List.of(view(task, includeOutput)))
            .orElse(List.of());
    }

    @Override
    public List<TaskStatusView> taskStatus(TaskFilter filter, boolean includeOutput) {
        return taskRepository.find(filter).stream()
            .map(task -> view(task, includeOutput))
            .toList();
    }

    @Override
    public List<TaskStatusView> taskStatus(Predicate<ScheduledTask> predicate, boolean includeOutput) {
        return taskRepository.find(TaskFilter.all().withLimit(Integer.MAX_VALUE)).stream()
            .filter(predicate)
            .map(task -> view(task, includeOutput))
            .toList();
    }

    @Override
    public List<TaskRun> taskRuns(long taskId) {
        taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", String.valueOf(taskId)));
        return runRepository.findByTask(taskId);
    }

    // ========== Cancellation ==========

    @Override
    public boolean stopTask(long taskId) {
        ScheduledTask task = taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", String.valueOf(taskId)));
        return stop(task);
    }

    @Override
    public boolean stopTask(String uuid) {
        ScheduledTask task = taskRepository.findByUuid(uuid)
            .orElseThrow(() -> new NotFoundException("Task", uuid));
        return stop(task);
    }

    // ========== Worker Administration ==========

    @Override
    public List<WorkerRecord> listWorkers() {
        return workerRepository.findAll();
    }

    @Override
    public boolean setWorkerStatus(String workerId, WorkerStatus status) {
        boolean updated = workerRepository.updateStatus(workerId, status);
        if (updated) {
            log.info("Worker {} set to {}", workerId, status);
        } else {
            log.warn("Cannot set status of unknown worker {}", workerId);
        }
        return updated;
    }

    @Override
    public int setGroupStatus(String groupName, WorkerStatus status) {
        int updated = 0;
        for (WorkerRecord worker : workerRepository.findAll()) {
            if (worker.serves(groupName) && workerRepository.updateStatus(worker.workerId(), status)) {
                updated++;
            }
        }
        log.info("Set {} workers of group {} to {}", updated, groupName, status);
        return updated;
    }

    // ========== Helper Methods ==========

    private Map<String, String> validate(TaskRequest request, Instant now) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (request.functionName() == null || request.functionName().isBlank()) {
            errors.put("function_name", "required");
        } else if (!functionCatalog.test(request.functionName())) {
            errors.put("function_name", "no function registered as '" + request.functionName() + "'");
        }
        if (request.groupName() == null || request.groupName().isBlank()) {
            errors.put("group_name", "required");
        } else if (request.groupName().contains(",")) {
            errors.put("group_name", "must not contain ','");
        }

        if (request.cronExpression() != null && request.period() != null) {
            errors.put("schedule", "cron_expression and period are mutually exclusive");
        } else if (request.cronExpression() != null) {
            try {
                calculator.cron(request.cronExpression());
            } catch (CronParseException e) {
                errors.put("cron_expression", e.getMessage());
            }
        } else if (request.period() != null && request.period().compareTo(MIN_PERIOD) < 0) {
            errors.put("period", "must be at least " + MIN_PERIOD.toSeconds() + "s");
        }

        if (request.repeats() < 0) {
            errors.put("repeats", "must not be negative");
        }
        if (request.retryFailed() < 0) {
            errors.put("retry_failed", "must not be negative");
        }
        if (request.timeout() == null || !isPositive(request.timeout())) {
            errors.put("timeout", "must be positive");
        }
        if (request.syncOutputInterval() != null && request.syncOutputInterval().isNegative()) {
            errors.put("sync_output", "must not be negative");
        }

        if (request.stopTime() != null) {
            if (request.stopTime().isBefore(now)) {
                errors.put("stop_time", "already passed");
            } else if (request.startTime() != null && request.stopTime().isBefore(request.startTime())) {
                errors.put("stop_time", "before start_time");
            }
        }
        return errors;
    }

    private ScheduledTask toTask(TaskRequest request, String uuid, Instant now) {
        ScheduledTask task = ScheduledTask.builder()
            .uuid(uuid)
            .taskName(request.taskName() != null ? request.taskName() : request.functionName())
            .groupName(request.groupName())
            .functionName(request.functionName())
            .args(request.args())
            .kwargs(request.kwargs())
            .status(TaskStatus.QUEUED)
            .cronExpression(request.cronExpression())
            .startTime(request.startTime())
            .stopTime(request.stopTime())
            .period(request.period())
            .preventDrift(request.preventDrift())
            .immediate(request.immediate())
            .repeats(request.repeats())
            .retryFailed(request.retryFailed())
            .timeout(request.timeout())
            .syncOutputInterval(request.syncOutputInterval() != null
                ? request.syncOutputInterval() : Duration.ZERO)
            .createdAt(now)
            .updatedAt(now)
            .build();
        return task.toBuilder()
            .nextRunTime(calculator.firstRunTime(task, now))
            .build();
    }

    private ScheduledTask replace(ScheduledTask existing, TaskRequest request, Instant now) {
        ScheduledTask replacement = toTask(request, existing.uuid(), now).toBuilder()
            .id(existing.id())
            .claimToken(existing.claimToken())
            .createdAt(existing.createdAt())
            .build();
        taskRepository.update(replacement);
        log.info("Overwrote definition of task {} ({})", existing.id(), existing.uuid());
        return replacement;
    }

    private void checkAcyclic(String jobName, long successorId, Collection<Long> predecessorIds) {
        DependencyGraph graph = DependencyGraph.fromEdges(dependencyRepository.findAll());
        Set<Long> taskIds = new HashSet<>(predecessorIds);
        taskIds.add(successorId);
        List<DependencyEdge> edges = predecessorIds.stream()
            .map(predecessorId -> DependencyEdge.of(jobName, predecessorId, successorId))
            .toList();
        graph.addEdges(jobName, taskIds, edges);
    }

    private void saveNewEdges(String jobName, long successorId, Map<Long, ScheduledTask> predecessors) {
        Set<Long> linked = new HashSet<>();
        for (DependencyEdge edge : dependencyRepository.findBySuccessors(List.of(successorId))) {
            if (edge.jobName().equals(jobName)) {
                linked.add(edge.predecessorId());
            }
        }
        List<DependencyEdge> edges = new ArrayList<>();
        predecessors.forEach((predecessorId, predecessor) -> {
            if (!linked.contains(predecessorId)) {
                edges.add(DependencyEdge.of(jobName, predecessorId, successorId)
                    .withSatisfied(isSatisfied(predecessor)));
            }
        });
        dependencyRepository.saveAll(edges);
    }

    private boolean stop(ScheduledTask task) {
        boolean stopped = taskRepository.stop(task.id(), clock.instant());
        if (stopped) {
            log.info("Stopped task {} ({}), was {}", task.id(), task.uuid(), task.status());
        } else {
            log.info("Task {} ({}) is already {}, nothing to stop", task.id(), task.uuid(), task.status());
        }
        return stopped;
    }

    private TaskStatusView view(ScheduledTask task, boolean includeOutput) {
        TaskRun latest = includeOutput
            ? runRepository.findLatestByTask(task.id()).orElse(null)
            : null;
        return new TaskStatusView(task, latest);
    }

    private static boolean isSatisfied(ScheduledTask predecessor) {
        return predecessor.status() == TaskStatus.COMPLETED;
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private static String key(DependencyEdge edge) {
        return edge.predecessorId() + "->" + edge.successorId();
    }
}
