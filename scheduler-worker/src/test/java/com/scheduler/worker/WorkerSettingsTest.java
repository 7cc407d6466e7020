package com.scheduler.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class WorkerSettingsTest {

    @Test
    @DisplayName("A group name containing a comma is rejected")
    void commaInGroup() {
        assertThatThrownBy(() -> WorkerSettings.defaults("host#1", Set.of("main", "etl,reports")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("etl,reports");
    }

    @Test
    @DisplayName("A blank group name is rejected")
    void blankGroup() {
        assertThatThrownBy(() -> WorkerSettings.defaults("host#1", Set.of(" ")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Valid groups are kept as given")
    void validGroups() {
        WorkerSettings settings = WorkerSettings.defaults("host#1", Set.of("main", "etl"));

        assertThat(settings.groupNames()).containsExactlyInAnyOrder("main", "etl");
        assertThat(settings.batchSize()).isEqualTo(10);
    }
}
