package com.scheduler.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scheduler.core.repository.DependencyRepository;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.repository.TaskRunRepository;
import com.scheduler.core.repository.WorkerRepository;
import com.scheduler.engine.persistence.InMemoryDependencyRepository;
import com.scheduler.engine.persistence.InMemoryTaskRepository;
import com.scheduler.engine.persistence.InMemoryTaskRunRepository;
import com.scheduler.engine.persistence.InMemoryWorkerRepository;
import com.scheduler.engine.persistence.jdbc.JdbcDependencyRepository;
import com.scheduler.engine.persistence.jdbc.JdbcTaskRepository;
import com.scheduler.engine.persistence.jdbc.JdbcTaskRunRepository;
import com.scheduler.engine.persistence.jdbc.JdbcWorkerRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Registry implementation selected by {@code scheduler.store}.
 */
public class StoreConfiguration {

    /**
     * Shared database registry; the only store that coordinates several processes.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "scheduler", name = "store", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStore {

        @Bean
        TaskRepository taskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        TaskRunRepository taskRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskRunRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        WorkerRepository workerRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcWorkerRepository(jdbcTemplate);
        }

        @Bean
        DependencyRepository dependencyRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcDependencyRepository(jdbcTemplate);
        }
    }

    /**
     * Process-local registry for development and single-process deployments.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "scheduler", name = "store", havingValue = "memory")
    static class InMemoryStore {

        @Bean
        InMemoryDependencyRepository dependencyRepository() {
            return new InMemoryDependencyRepository();
        }

        @Bean
        TaskRepository taskRepository(InMemoryDependencyRepository dependencyRepository) {
            return new InMemoryTaskRepository(dependencyRepository);
        }

        @Bean
        TaskRunRepository taskRunRepository() {
            return new InMemoryTaskRunRepository();
        }

        @Bean
        WorkerRepository workerRepository() {
            return new InMemoryWorkerRepository();
        }
    }
}
