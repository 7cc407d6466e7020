package com.scheduler.core.model;

/**
 * "successor must not start until predecessor completes" within a named job.
 * 
 * Primary Key: {jobName, predecessorId, successorId}
 */
public record DependencyEdge(
    String jobName,
    long predecessorId,
    long successorId,
    boolean satisfied
) {
    public static DependencyEdge of(String jobName, long predecessorId, long successorId) {
        return new DependencyEdge(jobName, predecessorId, successorId, false);
    }

    public DependencyEdge withSatisfied(boolean value) {
        return new DependencyEdge(jobName, predecessorId, successorId, value);
    }
}
