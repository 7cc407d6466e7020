package com.scheduler.core.exception;

/**
 * Thrown when a task is registered with a uuid that already exists.
 */
public class DuplicateTaskException extends SchedulerException {
    
    public static final String ERROR_CODE = "DUPLICATE_TASK";
    
    private final Long existingTaskId;
    
    public DuplicateTaskException(String uuid, Long existingTaskId) {
        super(ERROR_CODE, String.format(
            "Task with uuid '%s' already exists: %s",
            uuid, existingTaskId
        ));
        this.existingTaskId = existingTaskId;
    }
    
    public Long getExistingTaskId() {
        return existingTaskId;
    }
}
