package com.scheduler.core.repository;

import com.scheduler.core.model.DependencyEdge;
import java.util.Collection;
import java.util.List;

/**
 * Repository for dependency edges between tasks.
 */
public interface DependencyRepository {

    /**
     * Save a batch of edges. Either all edges are stored or none.
     *
     * @param edges The edges to save
     */
    void saveAll(Collection<DependencyEdge> edges);

    /**
     * Find the edges of a job.
     *
     * @param jobName The job name
     * @return The job's edges
     */
    List<DependencyEdge> findByJob(String jobName);

    /**
     * Find the edges entering any of the given tasks.
     *
     * @param successorIds The task IDs
     * @return Incoming edges
     */
    List<DependencyEdge> findBySuccessors(Collection<Long> successorIds);

    /**
     * Find every edge.
     *
     * @return All edges
     */
    List<DependencyEdge> findAll();
}
