package com.scheduler.worker.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * How child JVMs are launched and watched.
 *
 * @param javaCommand Path of the java launcher
 * @param classpath Classpath of the child; must contain the task functions
 * @param jvmArgs Extra JVM options, e.g. {@code -Xmx256m}
 * @param workDirectory Where result files are created, null for the system temp directory
 * @param monitorInterval How often the child is checked for exit and timeout
 * @param stopCheckInterval How often the worker is asked whether to stop the task
 */
public record ChildProcessSettings(
    String javaCommand,
    String classpath,
    List<String> jvmArgs,
    Path workDirectory,
    Duration monitorInterval,
    Duration stopCheckInterval
) {
    public ChildProcessSettings {
        jvmArgs = jvmArgs == null ? List.of() : List.copyOf(jvmArgs);
    }

    /**
     * Launch children with this JVM's java binary and classpath.
     */
    public static ChildProcessSettings defaults() {
        return new ChildProcessSettings(
            currentJava(),
            System.getProperty("java.class.path"),
            List.of(),
            null,
            Duration.ofMillis(100),
            Duration.ofSeconds(1)
        );
    }

    public ChildProcessSettings withJvmArgs(List<String> args) {
        return new ChildProcessSettings(javaCommand, classpath, args, workDirectory,
            monitorInterval, stopCheckInterval);
    }

    public ChildProcessSettings withStopCheckInterval(Duration interval) {
        return new ChildProcessSettings(javaCommand, classpath, jvmArgs, workDirectory,
            monitorInterval, interval);
    }

    static String currentJava() {
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }
}
