package com.scheduler.worker.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.scheduler.worker.function.TaskFunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class TaskProcessMainTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ByteArrayOutputStream captured;
    private PrintStream output;

    @BeforeEach
    void setUp() {
        captured = new ByteArrayOutputStream();
        output = new PrintStream(captured, true, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("A completed function yields its result and its printed output")
    void run_completed() {
        ChildResult result = TaskProcessMain.run(
            invocation("test.echo"), TaskFunctionRegistry.loadDefault(), objectMapper, output);

        assertThat(result.completed()).isTrue();
        assertThat(result.result().get("taskId").asLong()).isEqualTo(7L);
        assertThat(captured.toString(StandardCharsets.UTF_8)).isEqualTo("hello ada");
        assertThat(result.exitCode()).isZero();
    }

    @Test
    @DisplayName("A function failure carries its error code and stack trace")
    void run_failed() {
        ChildResult result = TaskProcessMain.run(
            invocation("test.fail"), TaskFunctionRegistry.loadDefault(), objectMapper, output);

        assertThat(result.completed()).isFalse();
        assertThat(result.errorCode()).isEqualTo("BOOM");
        assertThat(result.traceback()).contains("boom in task nightly");
        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unexpected exceptions are reported as failures")
    void run_crashed() {
        ChildResult result = TaskProcessMain.run(
            invocation("test.crash"), TaskFunctionRegistry.loadDefault(), objectMapper, output);

        assertThat(result.errorCode()).isEqualTo("UNEXPECTED_ERROR");
        assertThat(result.traceback()).contains("IllegalStateException", "unexpected crash");
    }

    @Test
    @DisplayName("Unknown function names fail without loading any code")
    void run_unknownFunction() {
        ChildResult result = TaskProcessMain.run(
            invocation("java.lang.Runtime.exec"), TaskFunctionRegistry.loadDefault(), objectMapper, output);

        assertThat(result.errorCode()).isEqualTo("UNKNOWN_FUNCTION");
        assertThat(result.traceback()).contains("java.lang.Runtime.exec");
    }

    private static TaskInvocation invocation(String functionName) {
        return new TaskInvocation(7L, "nightly", 11L, functionName,
            JsonNodeFactory.instance.arrayNode().add(1),
            JsonNodeFactory.instance.objectNode().put("name", "ada"));
    }
}
