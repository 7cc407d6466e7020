package com.scheduler.worker.function;

import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TaskFunctionRegistryTest {

    @Test
    @DisplayName("Providers on the classpath are discovered")
    void loadDefault_discoversProviders() {
        TaskFunctionRegistry registry = TaskFunctionRegistry.loadDefault();

        assertThat(registry.names()).contains("test.echo", "test.fail", "test.sleep");
        assertThat(registry.contains("test.echo")).isTrue();
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    @DisplayName("A function name can be registered once")
    void register_rejectsDuplicates() {
        TaskFunctionRegistry registry = new TaskFunctionRegistry()
            .register("noop", context -> NullNode.getInstance());

        assertThatThrownBy(() -> registry.register("noop", context -> null))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.register(" ", context -> null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
