package com.scheduler.worker.function;

import java.util.Map;

/**
 * Functions used by worker tests, loaded through ServiceLoader in child processes too.
 */
public class TestFunctionProvider implements TaskFunctionProvider {

    @Override
    public void registerFunctions(TaskFunctionRegistry registry) {
        registry
            .register("test.echo", context -> {
                context.print("hello " + context.kwarg("name").asText("world"));
                return context.toJsonNode(Map.of("args", context.getArgs(), "taskId", context.getTaskId()));
            })
            .register("test.fail", context -> {
                context.println("about to fail");
                throw new TaskFunctionException("BOOM", "boom in task " + context.getTaskUuid());
            })
            .register("test.crash", context -> {
                throw new IllegalStateException("unexpected crash");
            })
            .register("test.exit", context -> {
                System.err.println("exiting hard");
                System.exit(7);
                return null;
            })
            .register("test.sleep", context -> {
                context.println("started");
                pause(context.kwarg("millis").asLong(60_000));
                return null;
            })
            .register("test.progress", context -> {
                context.print("10%");
                context.clearOutput();
                context.print("50%");
                pause(1_500);
                context.clearOutput();
                context.print("done");
                return context.toJsonNode(100);
            });
    }

    private static void pause(long millis) throws TaskFunctionException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskFunctionException("INTERRUPTED", "interrupted", e);
        }
    }
}
