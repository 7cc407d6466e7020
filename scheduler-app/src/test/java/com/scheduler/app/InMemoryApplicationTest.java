package com.scheduler.app;

import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.engine.persistence.InMemoryTaskRepository;
import com.scheduler.engine.service.SchedulerService;
import com.scheduler.engine.service.SchedulerService.QueueResult;
import com.scheduler.engine.service.TaskRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = "scheduler.autostart=false")
@ActiveProfiles("memory")
class InMemoryApplicationTest {

    @Autowired
    private SchedulerService schedulerService;

    @Autowired
    private TaskRepository taskRepository;

    @Test
    @DisplayName("The memory profile runs without a database")
    void memoryProfile() {
        assertThat(taskRepository).isInstanceOf(InMemoryTaskRepository.class);

        QueueResult result = schedulerService.queueTask(TaskRequest.builder("builtin.sleep")
            .uuid("memory-sleep")
            .cronExpression("*/5 * * * *")
            .repeats(0)
            .build());

        assertThat(result.isValid()).isTrue();
        assertThat(taskRepository.findById(result.id()).orElseThrow().status()).isEqualTo(TaskStatus.QUEUED);
    }
}
