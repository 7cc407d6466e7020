package com.scheduler.core.exception;

import java.util.List;

/**
 * Thrown when a batch of dependency edges would close a cycle.
 * None of the edges in the rejected batch are kept.
 */
public class CyclicDependencyException extends SchedulerException {
    
    public static final String ERROR_CODE = "CYCLIC_DEPENDENCY";
    
    private final String jobName;
    private final List<Long> unresolvedTasks;
    
    public CyclicDependencyException(String jobName, List<Long> unresolvedTasks) {
        super(ERROR_CODE, String.format(
            "Dependencies of job '%s' contain a cycle through tasks %s",
            jobName, unresolvedTasks
        ));
        this.jobName = jobName;
        this.unresolvedTasks = List.copyOf(unresolvedTasks);
    }
    
    public String getJobName() {
        return jobName;
    }
    
    /**
     * Tasks that could not be ordered; every cycle runs through them.
     */
    public List<Long> getUnresolvedTasks() {
        return unresolvedTasks;
    }
}
