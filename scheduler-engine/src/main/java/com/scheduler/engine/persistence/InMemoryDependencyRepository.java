package com.scheduler.engine.persistence;

import com.scheduler.core.model.DependencyEdge;
import com.scheduler.core.repository.DependencyRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of DependencyRepository.
 * For single-process deployments and testing.
 */
@Repository
public class InMemoryDependencyRepository implements DependencyRepository {

    private static final Comparator<DependencyEdge> ORDER = Comparator
        .comparing(DependencyEdge::jobName)
        .thenComparingLong(DependencyEdge::predecessorId)
        .thenComparingLong(DependencyEdge::successorId);

    private final List<DependencyEdge> edges = new ArrayList<>();

    @Override
    public synchronized void saveAll(Collection<DependencyEdge> batch) {
        for (DependencyEdge edge : batch) {
            if (edges.stream().anyMatch(e -> sameKey(e, edge))) {
                throw new IllegalArgumentException("Edge already exists: " + edge);
            }
        }
        edges.addAll(batch);
    }

    @Override
    public synchronized List<DependencyEdge> findByJob(String jobName) {
        return select(e -> e.jobName().equals(jobName));
    }

    @Override
    public synchronized List<DependencyEdge> findBySuccessors(Collection<Long> successorIds) {
        Set<Long> ids = new HashSet<>(successorIds);
        return select(e -> ids.contains(e.successorId()));
    }

    @Override
    public synchronized List<DependencyEdge> findAll() {
        return select(e -> true);
    }

    /**
     * Check if any edge entering the task is unsatisfied.
     */
    synchronized boolean hasUnsatisfiedIncoming(long successorId) {
        return edges.stream().anyMatch(e -> e.successorId() == successorId && !e.satisfied());
    }

    /**
     * Rewrite the edges matching a predicate.
     */
    synchronized void updateWhere(Predicate<DependencyEdge> filter, UnaryOperator<DependencyEdge> change) {
        edges.replaceAll(e -> filter.test(e) ? change.apply(e) : e);
    }

    // ========== Helper Methods ==========

    private List<DependencyEdge> select(Predicate<DependencyEdge> filter) {
        return edges.stream().filter(filter).sorted(ORDER).toList();
    }

    private static boolean sameKey(DependencyEdge a, DependencyEdge b) {
        return a.jobName().equals(b.jobName())
            && a.predecessorId() == b.predecessorId()
            && a.successorId() == b.successorId();
    }
}
