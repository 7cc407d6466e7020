package com.scheduler.app.functions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scheduler.worker.function.TaskContext;
import com.scheduler.worker.function.TaskFunctionException;
import com.scheduler.worker.function.TaskFunctionProvider;
import com.scheduler.worker.function.TaskFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Functions every scheduler process ships with. Useful for smoke tests and as
 * templates for real task functions.
 *
 * <ul>
 *   <li>{@code builtin.echo}: returns its arguments</li>
 *   <li>{@code builtin.sleep}: sleeps {@code kwargs.seconds}, reporting progress</li>
 *   <li>{@code builtin.fail}: fails with {@code kwargs.message}</li>
 * </ul>
 */
public class BuiltinFunctions implements TaskFunctionProvider {

    private static final Logger log = LoggerFactory.getLogger(BuiltinFunctions.class);

    @Override
    public void registerFunctions(TaskFunctionRegistry registry) {
        registry
            .register("builtin.echo", BuiltinFunctions::echo)
            .register("builtin.sleep", BuiltinFunctions::sleep)
            .register("builtin.fail", BuiltinFunctions::fail);
    }

    static JsonNode echo(TaskContext context) {
        context.println("echo from task " + context.getTaskUuid());
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set("args", context.getArgs());
        result.set("kwargs", context.getKwargs());
        result.put("echoedAt", Instant.now().toString());
        return result;
    }

    static JsonNode sleep(TaskContext context) throws TaskFunctionException {
        int seconds = context.kwarg("seconds").asInt(1);
        for (int i = 1; i <= seconds; i++) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskFunctionException("INTERRUPTED", "Sleep interrupted after " + (i - 1) + "s", e);
            }
            context.clearOutput();
            context.print(i + "/" + seconds + "s");
        }
        log.debug("Task {} slept {}s", context.getTaskUuid(), seconds);
        return context.toJsonNode(seconds);
    }

    static JsonNode fail(TaskContext context) throws TaskFunctionException {
        String message = context.kwarg("message").asText("Requested failure");
        context.println("failing: " + message);
        throw new TaskFunctionException("REQUESTED_FAILURE", message);
    }
}
