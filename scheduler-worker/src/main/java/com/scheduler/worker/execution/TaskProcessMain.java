package com.scheduler.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scheduler.worker.function.TaskContext;
import com.scheduler.worker.function.TaskFunction;
import com.scheduler.worker.function.TaskFunctionException;
import com.scheduler.worker.function.TaskFunctionRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point of the child JVM that runs one task.
 *
 * Reads a {@link TaskInvocation} from stdin, runs the named function, and writes
 * a {@link ChildResult} to the file given as the only argument. Stdout carries
 * nothing but the task's own output; anything else written to {@code System.out}
 * (library logging included) goes to stderr.
 *
 * Exit codes: 0 completed, 1 failed, 2 bad usage, 3 result not written.
 */
public final class TaskProcessMain {

    private TaskProcessMain() {
    }

    public static void main(String[] args) {
        PrintStream taskOutput = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.setOut(System.err);

        if (args.length != 1) {
            System.err.println("Usage: TaskProcessMain <result-file>");
            System.exit(2);
        }

        ObjectMapper objectMapper = new ObjectMapper();
        ChildResult result;
        try {
            TaskInvocation invocation = objectMapper.readValue(System.in, TaskInvocation.class);
            result = run(invocation, TaskFunctionRegistry.loadDefault(), objectMapper, taskOutput);
        } catch (IOException e) {
            result = ChildResult.failed("INVALID_INVOCATION", stackTrace(e));
        }
        taskOutput.flush();

        try {
            objectMapper.writeValue(Path.of(args[0]).toFile(), result);
        } catch (IOException e) {
            e.printStackTrace();
            System.exit(3);
        }
        System.exit(result.exitCode());
    }

    /**
     * Run a function in this process.
     */
    static ChildResult run(TaskInvocation invocation, TaskFunctionRegistry registry,
                           ObjectMapper objectMapper, PrintStream taskOutput) {
        Optional<TaskFunction> function = registry.find(invocation.functionName());
        if (function.isEmpty()) {
            return ChildResult.failed("UNKNOWN_FUNCTION",
                "No task function registered as '" + invocation.functionName()
                    + "'; known functions: " + registry.names());
        }

        TaskContext context = new TaskContext(
            invocation.taskId(),
            invocation.taskUuid(),
            invocation.runId(),
            invocation.args(),
            invocation.kwargs(),
            objectMapper,
            taskOutput
        );

        try {
            JsonNode value = function.get().execute(context);
            return ChildResult.completed(value);
        } catch (TaskFunctionException e) {
            return ChildResult.failed(e.getErrorCode(), stackTrace(e));
        } catch (RuntimeException e) {
            return ChildResult.failed("UNEXPECTED_ERROR", stackTrace(e));
        }
    }

    static String stackTrace(Throwable e) {
        StringWriter sw = new StringWriter();
        e.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
