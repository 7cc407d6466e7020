package com.scheduler.engine.persistence;

import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.repository.TaskRunRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of TaskRunRepository.
 * For single-process deployments and testing.
 */
@Repository
public class InMemoryTaskRunRepository implements TaskRunRepository {

    private final Map<Long, TaskRun> runs = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(0);

    @Override
    public TaskRun save(TaskRun run) {
        TaskRun saved = run.withRunId(idSequence.incrementAndGet());
        runs.put(saved.runId(), saved);
        return saved;
    }

    @Override
    public void updateOutput(long runId, String output) {
        runs.computeIfPresent(runId, (id, run) ->
            run.status() == RunStatus.RUNNING ? run.withOutput(output) : run);
    }

    @Override
    public void finish(TaskRun run) {
        runs.computeIfPresent(run.runId(), (id, current) ->
            current.status() == RunStatus.RUNNING ? run : current);
    }

    @Override
    public Optional<TaskRun> findById(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<TaskRun> findByTask(long taskId) {
        return runs.values().stream()
            .filter(r -> r.taskId() == taskId)
            .sorted(Comparator.comparing(TaskRun::runId))
            .toList();
    }

    @Override
    public Optional<TaskRun> findLatestByTask(long taskId) {
        return runs.values().stream()
            .filter(r -> r.taskId() == taskId)
            .max(Comparator.comparing(TaskRun::runId));
    }

    @Override
    public synchronized int markLost(String workerId, Instant now) {
        int marked = 0;
        for (TaskRun run : List.copyOf(runs.values())) {
            if (run.status() == RunStatus.RUNNING && workerId.equals(run.workerId())) {
                runs.put(run.runId(), run.withFinished(RunStatus.LOST, now, run.output(), null,
                    "Worker stopped heartbeating; task requeued"));
                marked++;
            }
        }
        return marked;
    }
}
