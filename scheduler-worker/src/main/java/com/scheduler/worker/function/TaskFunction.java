package com.scheduler.worker.function;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business logic run by a scheduled task.
 * Implementations are registered by name through a {@link TaskFunctionProvider}
 * and always run inside a child process.
 */
@FunctionalInterface
public interface TaskFunction {

    /**
     * Run the task.
     *
     * @param context Arguments, task identity and output helpers
     * @return The result stored with the run, or null
     * @throws TaskFunctionException if the run failed
     */
    JsonNode execute(TaskContext context) throws TaskFunctionException;
}
