package com.scheduler.worker.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.PrintStream;

/**
 * Context provided to task functions during execution.
 *
 * Text printed here is the run's output. The worker stores it while the task
 * runs, at most once per sync interval, and once more when the run ends.
 */
public class TaskContext {

    /**
     * Printing this marker discards all output printed before it.
     */
    public static final String CLEAR_MARKER = "!clear!";

    private final long taskId;
    private final String taskUuid;
    private final long runId;
    private final JsonNode args;
    private final JsonNode kwargs;
    private final ObjectMapper objectMapper;
    private final PrintStream output;

    public TaskContext(
            long taskId,
            String taskUuid,
            long runId,
            JsonNode args,
            JsonNode kwargs,
            ObjectMapper objectMapper,
            PrintStream output) {
        this.taskId = taskId;
        this.taskUuid = taskUuid;
        this.runId = runId;
        this.args = args;
        this.kwargs = kwargs;
        this.objectMapper = objectMapper;
        this.output = output;
    }

    public long getTaskId() {
        return taskId;
    }

    public String getTaskUuid() {
        return taskUuid;
    }

    public long getRunId() {
        return runId;
    }

    /**
     * Positional arguments, a JSON array.
     */
    public JsonNode getArgs() {
        return args;
    }

    /**
     * Keyword arguments, a JSON object.
     */
    public JsonNode getKwargs() {
        return kwargs;
    }

    /**
     * Get one positional argument, or a missing node.
     */
    public JsonNode arg(int index) {
        JsonNode value = args.get(index);
        return value != null ? value : MissingNode.getInstance();
    }

    /**
     * Get one keyword argument, or a missing node.
     */
    public JsonNode kwarg(String name) {
        return kwargs.path(name);
    }

    /**
     * Get the keyword arguments as a specific type.
     */
    public <T> T getKwargs(Class<T> type) {
        return objectMapper.convertValue(kwargs, type);
    }

    public void print(String text) {
        output.print(text);
        output.flush();
    }

    public void println(String text) {
        output.println(text);
        output.flush();
    }

    /**
     * Replace everything printed so far with what is printed next.
     */
    public void clearOutput() {
        print(CLEAR_MARKER);
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
