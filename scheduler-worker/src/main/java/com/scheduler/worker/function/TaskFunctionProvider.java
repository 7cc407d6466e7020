package com.scheduler.worker.function;

/**
 * Contributes task functions. Implementations are discovered with
 * {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.scheduler.worker.function.TaskFunctionProvider}.
 */
public interface TaskFunctionProvider {

    void registerFunctions(TaskFunctionRegistry registry);
}
