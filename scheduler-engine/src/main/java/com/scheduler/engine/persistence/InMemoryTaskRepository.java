package com.scheduler.engine.persistence;

import com.scheduler.core.exception.DuplicateTaskException;
import com.scheduler.core.exception.NotFoundException;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.repository.TaskFilter;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.schedule.RunTransition;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of TaskRepository.
 * For single-process deployments and testing.
 *
 * Every mutating method is synchronized, which gives claims the same
 * exactly-one-winner behavior as the conditional UPDATE of the JDBC store.
 */
@Repository
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<Long, ScheduledTask> tasks = new TreeMap<>();
    private final AtomicLong idSequence = new AtomicLong(0);
    private final InMemoryDependencyRepository dependencies;

    public InMemoryTaskRepository(InMemoryDependencyRepository dependencies) {
        this.dependencies = dependencies;
    }

    @Override
    public synchronized ScheduledTask save(ScheduledTask task) {
        Optional<ScheduledTask> existing = findByUuid(task.uuid());
        if (existing.isPresent()) {
            throw new DuplicateTaskException(task.uuid(), existing.get().id());
        }
        ScheduledTask saved = task.toBuilder().id(idSequence.incrementAndGet()).build();
        tasks.put(saved.id(), saved);
        return saved;
    }

    @Override
    public synchronized void update(ScheduledTask task) {
        ScheduledTask existing = tasks.get(task.id());
        if (existing == null) {
            throw new NotFoundException("Task", String.valueOf(task.id()));
        }
        // Identity and claim history survive a redefinition
        tasks.put(task.id(), task.toBuilder()
            .uuid(existing.uuid())
            .claimToken(existing.claimToken())
            .createdAt(existing.createdAt())
            .build());
    }

    @Override
    public synchronized Optional<ScheduledTask> findById(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public synchronized Optional<ScheduledTask> findByUuid(String uuid) {
        return tasks.values().stream()
            .filter(t -> t.uuid().equals(uuid))
            .findFirst();
    }

    @Override
    public synchronized List<ScheduledTask> find(TaskFilter filter) {
        return tasks.values().stream()
            .filter(t -> filter.statuses().isEmpty() || filter.statuses().contains(t.status()))
            .filter(t -> filter.groupName() == null || filter.groupName().equals(t.groupName()))
            .filter(t -> filter.taskName() == null || filter.taskName().equals(t.taskName()))
            .filter(t -> filter.nextRunBefore() == null || !t.nextRunTime().isAfter(filter.nextRunBefore()))
            .limit(filter.limit())
            .toList();
    }

    @Override
    public synchronized List<ScheduledTask> findDue(Collection<String> groupNames, Instant now, int limit) {
        Set<String> groups = new HashSet<>(groupNames);
        return tasks.values().stream()
            .filter(t -> t.isDue(now))
            .filter(t -> groups.contains(t.groupName()))
            .sorted(Comparator.comparing(ScheduledTask::nextRunTime).thenComparing(ScheduledTask::id))
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized Optional<ScheduledTask> claim(long taskId, String workerId, Instant now) {
        ScheduledTask task = tasks.get(taskId);
        if (task == null || !task.isDue(now) || dependencies.hasUnsatisfiedIncoming(taskId)) {
            return Optional.empty();
        }
        ScheduledTask claimed = task.withAssigned(workerId, now);
        tasks.put(taskId, claimed);
        return Optional.of(claimed);
    }

    @Override
    public synchronized boolean markRunning(long taskId, String workerId, long claimToken, Instant now) {
        ScheduledTask task = tasks.get(taskId);
        if (!ownedBy(task, workerId, claimToken) || task.status() != TaskStatus.ASSIGNED) {
            return false;
        }
        tasks.put(taskId, task.withRunning(now));
        return true;
    }

    @Override
    public synchronized boolean applyTransition(long taskId, String workerId, long claimToken,
                                                RunTransition transition, Instant now) {
        ScheduledTask task = tasks.get(taskId);
        if (!ownedBy(task, workerId, claimToken) || !task.status().isActive()) {
            return false;
        }
        tasks.put(taskId, transition.applyTo(task, now));

        if (transition.succeeded()) {
            dependencies.updateWhere(e -> e.predecessorId() == taskId, e -> e.withSatisfied(true));
            dependencies.updateWhere(
                e -> e.successorId() == taskId && isScheduled(e.predecessorId()),
                e -> e.withSatisfied(false));
        }
        return true;
    }

    @Override
    public synchronized boolean stop(long taskId, Instant now) {
        ScheduledTask task = tasks.get(taskId);
        if (task == null || !task.status().isStoppable()) {
            return false;
        }
        tasks.put(taskId, task.withStatus(TaskStatus.STOPPED, now));
        return true;
    }

    @Override
    public synchronized int requeueAbandoned(String workerId, Instant now) {
        int requeued = 0;
        for (ScheduledTask task : List.copyOf(tasks.values())) {
            if (!task.status().isActive() || !workerId.equals(task.assignedWorker())) {
                continue;
            }
            if (task.isPastStopTime(now)) {
                tasks.put(task.id(), task.withStatus(TaskStatus.EXPIRED, now));
            } else {
                tasks.put(task.id(), task.withReclaimed(now));
                requeued++;
            }
        }
        return requeued;
    }

    @Override
    public synchronized int expireOverdue(Instant now) {
        int expired = 0;
        for (ScheduledTask task : List.copyOf(tasks.values())) {
            if (task.status() == TaskStatus.QUEUED && task.isPastStopTime(now)) {
                tasks.put(task.id(), task.withStatus(TaskStatus.EXPIRED, now));
                expired++;
            }
        }
        return expired;
    }

    // ========== Helper Methods ==========

    private static boolean ownedBy(ScheduledTask task, String workerId, long claimToken) {
        return task != null
            && workerId.equals(task.assignedWorker())
            && task.claimToken() == claimToken;
    }

    private boolean isScheduled(long taskId) {
        ScheduledTask task = tasks.get(taskId);
        return task != null && !task.status().isTerminal();
    }
}
