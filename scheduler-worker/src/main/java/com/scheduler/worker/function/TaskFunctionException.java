package com.scheduler.worker.function;

/**
 * Exception thrown by task functions on failure.
 * A failed run is retried while the task has retry budget left.
 */
public class TaskFunctionException extends Exception {

    private final String errorCode;

    public TaskFunctionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskFunctionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
