package com.scheduler.app.config;

import com.scheduler.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code scheduler} prefix.
 */
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    public enum Store { JDBC, MEMORY }

    private Store store = Store.JDBC;

    /** Zone cron fields are evaluated in. */
    private String zone = "UTC";

    /** Start the worker loop once the application is ready. */
    private boolean autostart = true;

    /** Workers silent for longer than this are treated as lost. */
    private Duration staleThreshold = Duration.ofSeconds(30);

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Child child = new Child();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }

    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    public void setStaleThreshold(Duration staleThreshold) {
        this.staleThreshold = staleThreshold;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Child getChild() {
        return child;
    }

    public static class Worker {

        /** Blank for {@code host#pid}. */
        private String id;
        private List<String> groups = new ArrayList<>(List.of("main"));
        private Duration pollInterval = Duration.ofSeconds(3);
        private Duration heartbeatInterval = Duration.ofSeconds(3);
        private Duration housekeepingInterval = Duration.ofSeconds(30);
        private int batchSize = 10;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public List<String> getGroups() {
            return groups;
        }

        public void setGroups(List<String> groups) {
            this.groups = groups;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getHousekeepingInterval() {
            return housekeepingInterval;
        }

        public void setHousekeepingInterval(Duration housekeepingInterval) {
            this.housekeepingInterval = housekeepingInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Retry {

        private RetryPolicy.Mode mode = RetryPolicy.Mode.IMMEDIATE;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private double jitter = 0.1;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .mode(mode)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(multiplier)
                .jitterFactor(jitter)
                .build();
        }

        public RetryPolicy.Mode getMode() {
            return mode;
        }

        public void setMode(RetryPolicy.Mode mode) {
            this.mode = mode;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * How task child processes are started. Blank command and classpath reuse this JVM's.
     */
    public static class Child {

        private String javaCommand;
        private String classpath;
        private List<String> jvmArgs = new ArrayList<>();
        private String workDirectory;
        private Duration monitorInterval = Duration.ofMillis(100);
        private Duration stopCheckInterval = Duration.ofSeconds(1);

        public String getJavaCommand() {
            return javaCommand;
        }

        public void setJavaCommand(String javaCommand) {
            this.javaCommand = javaCommand;
        }

        public String getClasspath() {
            return classpath;
        }

        public void setClasspath(String classpath) {
            this.classpath = classpath;
        }

        public List<String> getJvmArgs() {
            return jvmArgs;
        }

        public void setJvmArgs(List<String> jvmArgs) {
            this.jvmArgs = jvmArgs;
        }

        public String getWorkDirectory() {
            return workDirectory;
        }

        public void setWorkDirectory(String workDirectory) {
            this.workDirectory = workDirectory;
        }

        public Duration getMonitorInterval() {
            return monitorInterval;
        }

        public void setMonitorInterval(Duration monitorInterval) {
            this.monitorInterval = monitorInterval;
        }

        public Duration getStopCheckInterval() {
            return stopCheckInterval;
        }

        public void setStopCheckInterval(Duration stopCheckInterval) {
            this.stopCheckInterval = stopCheckInterval;
        }
    }
}
