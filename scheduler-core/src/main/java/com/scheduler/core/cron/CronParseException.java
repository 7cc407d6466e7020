package com.scheduler.core.cron;

import com.scheduler.core.exception.SchedulerException;

/**
 * Thrown when a cron expression cannot be parsed.
 */
public class CronParseException extends SchedulerException {
    
    public static final String ERROR_CODE = "INVALID_CRON_EXPRESSION";
    
    private final String expression;
    
    public CronParseException(String expression, String reason) {
        super(ERROR_CODE, String.format("Invalid cron expression '%s': %s", expression, reason));
        this.expression = expression;
    }
    
    public String getExpression() {
        return expression;
    }
}
