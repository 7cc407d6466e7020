package com.scheduler.core.exception;

/**
 * Base exception for all scheduler errors.
 */
public class SchedulerException extends RuntimeException {
    
    private final String errorCode;
    
    public SchedulerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public SchedulerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
