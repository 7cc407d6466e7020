package com.scheduler.engine.persistence;

import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.repository.WorkerRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkerRepository.
 * For single-process deployments and testing.
 */
@Repository
public class InMemoryWorkerRepository implements WorkerRepository {

    private final Map<String, WorkerRecord> workers = new ConcurrentHashMap<>();

    @Override
    public WorkerRecord heartbeat(String workerId, Set<String> groupNames, Instant now) {
        return workers.compute(workerId, (id, existing) -> existing == null
            ? WorkerRecord.create(id, groupNames, now)
            : new WorkerRecord(id, Set.copyOf(groupNames), existing.firstHeartbeat(), now, existing.status()));
    }

    @Override
    public Optional<WorkerRecord> findById(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    @Override
    public List<WorkerRecord> findAll() {
        return workers.values().stream()
            .sorted(Comparator.comparing(WorkerRecord::workerId))
            .toList();
    }

    @Override
    public List<WorkerRecord> findStale(Instant cutoff) {
        return workers.values().stream()
            .filter(w -> w.lastHeartbeat().isBefore(cutoff))
            .sorted(Comparator.comparing(WorkerRecord::workerId))
            .toList();
    }

    @Override
    public boolean updateStatus(String workerId, WorkerStatus status) {
        return workers.computeIfPresent(workerId, (id, w) -> w.withStatus(status)) != null;
    }

    @Override
    public boolean delete(String workerId) {
        return workers.remove(workerId) != null;
    }
}
