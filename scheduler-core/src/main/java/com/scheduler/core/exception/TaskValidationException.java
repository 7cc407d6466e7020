package com.scheduler.core.exception;

import java.util.Map;

/**
 * Thrown when a task registration carries invalid parameters.
 */
public class TaskValidationException extends SchedulerException {
    
    public static final String ERROR_CODE = "TASK_VALIDATION_FAILED";
    
    private final Map<String, String> errors;
    
    public TaskValidationException(String field, String reason) {
        this(Map.of(field, reason));
    }
    
    public TaskValidationException(Map<String, String> errors) {
        super(ERROR_CODE, String.format("Invalid task definition: %s", errors));
        this.errors = Map.copyOf(errors);
    }
    
    public Map<String, String> getErrors() {
        return errors;
    }
}
