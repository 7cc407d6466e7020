package com.scheduler.worker.function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named table of task functions. Tasks refer to functions only by these names.
 */
public class TaskFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskFunctionRegistry.class);

    private final Map<String, TaskFunction> functions = new ConcurrentHashMap<>();

    /**
     * Build a registry from every {@link TaskFunctionProvider} on the classpath.
     */
    public static TaskFunctionRegistry loadDefault() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static TaskFunctionRegistry load(ClassLoader classLoader) {
        TaskFunctionRegistry registry = new TaskFunctionRegistry();
        for (TaskFunctionProvider provider : ServiceLoader.load(TaskFunctionProvider.class, classLoader)) {
            provider.registerFunctions(registry);
        }
        return registry;
    }

    /**
     * Register a function.
     *
     * @throws IllegalStateException if the name is taken
     */
    public TaskFunctionRegistry register(String name, TaskFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        TaskFunction previous = functions.putIfAbsent(name, function);
        if (previous != null) {
            throw new IllegalStateException("Task function already registered: " + name);
        }
        log.debug("Registered task function: {}", name);
        return this;
    }

    public Optional<TaskFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }
}
