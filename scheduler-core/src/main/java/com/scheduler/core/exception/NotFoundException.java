package com.scheduler.core.exception;

/**
 * Thrown when a task or worker is not found.
 */
public class NotFoundException extends SchedulerException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
