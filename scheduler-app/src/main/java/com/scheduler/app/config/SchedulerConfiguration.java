package com.scheduler.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scheduler.core.repository.DependencyRepository;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.repository.TaskRunRepository;
import com.scheduler.core.repository.WorkerRepository;
import com.scheduler.core.schedule.RunResultPolicy;
import com.scheduler.core.schedule.ScheduleCalculator;
import com.scheduler.engine.coordinator.TaskRegistry;
import com.scheduler.engine.metrics.SchedulerMetrics;
import com.scheduler.recovery.Housekeeper;
import com.scheduler.worker.SchedulerWorker;
import com.scheduler.worker.WorkerSettings;
import com.scheduler.worker.execution.ChildProcessSettings;
import com.scheduler.worker.execution.ChildProcessTaskExecutor;
import com.scheduler.worker.execution.TaskExecutor;
import com.scheduler.worker.function.TaskFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashSet;

/**
 * Wires the registry service and this process's worker.
 */
@Configuration
public class SchedulerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScheduleCalculator scheduleCalculator(SchedulerProperties properties) {
        return new ScheduleCalculator(ZoneId.of(properties.getZone()));
    }

    @Bean
    public RunResultPolicy runResultPolicy(ScheduleCalculator calculator, SchedulerProperties properties) {
        return new RunResultPolicy(calculator, properties.getRetry().toPolicy());
    }

    @Bean
    public TaskFunctionRegistry taskFunctionRegistry() {
        TaskFunctionRegistry registry = TaskFunctionRegistry.loadDefault();
        log.info("Task functions available: {}", registry.names());
        return registry;
    }

    @Bean
    public TaskRegistry taskRegistry(
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            DependencyRepository dependencyRepository,
            ScheduleCalculator calculator,
            Clock clock,
            SchedulerMetrics metrics,
            TaskFunctionRegistry functions) {
        return new TaskRegistry(taskRepository, runRepository, workerRepository, dependencyRepository,
            calculator, clock, metrics, functions::contains);
    }

    @Bean
    public Housekeeper housekeeper(
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            Clock clock,
            SchedulerProperties properties,
            SchedulerMetrics metrics) {
        return new Housekeeper(taskRepository, runRepository, workerRepository,
            clock, properties.getStaleThreshold(), metrics);
    }

    @Bean
    public TaskExecutor taskExecutor(ObjectMapper objectMapper, SchedulerProperties properties) {
        return new ChildProcessTaskExecutor(objectMapper, childSettings(properties.getChild()));
    }

    @Bean
    public WorkerSettings workerSettings(SchedulerProperties properties) {
        SchedulerProperties.Worker worker = properties.getWorker();
        String workerId = isBlank(worker.getId()) ? defaultWorkerId() : worker.getId();
        return new WorkerSettings(
            workerId,
            new LinkedHashSet<>(worker.getGroups()),
            worker.getPollInterval(),
            worker.getHeartbeatInterval(),
            worker.getHousekeepingInterval(),
            worker.getBatchSize()
        );
    }

    @Bean
    public SchedulerWorker schedulerWorker(
            WorkerSettings settings,
            TaskRepository taskRepository,
            TaskRunRepository runRepository,
            WorkerRepository workerRepository,
            DependencyRepository dependencyRepository,
            RunResultPolicy resultPolicy,
            TaskExecutor taskExecutor,
            Housekeeper housekeeper,
            Clock clock,
            SchedulerMetrics metrics) {
        return new SchedulerWorker(settings, taskRepository, runRepository, workerRepository,
            dependencyRepository, resultPolicy, taskExecutor, housekeeper, clock, metrics);
    }

    // ========== Helper Methods ==========

    static ChildProcessSettings childSettings(SchedulerProperties.Child child) {
        ChildProcessSettings defaults = ChildProcessSettings.defaults();
        return new ChildProcessSettings(
            isBlank(child.getJavaCommand()) ? defaults.javaCommand() : child.getJavaCommand(),
            isBlank(child.getClasspath()) ? defaults.classpath() : child.getClasspath(),
            child.getJvmArgs(),
            isBlank(child.getWorkDirectory()) ? null : Path.of(child.getWorkDirectory()),
            child.getMonitorInterval(),
            child.getStopCheckInterval()
        );
    }

    static String defaultWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve host name, using localhost in the worker id", e);
            host = "localhost";
        }
        return host + "#" + ProcessHandle.current().pid();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
