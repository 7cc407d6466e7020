package com.scheduler.app;

import com.scheduler.app.config.SchedulerProperties;
import com.scheduler.worker.SchedulerWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the worker once the application is up and stops it on shutdown.
 */
@Component
public class WorkerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycle.class);

    private final SchedulerWorker worker;
    private final SchedulerProperties properties;

    public WorkerLifecycle(SchedulerWorker worker, SchedulerProperties properties) {
        this.worker = worker;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.isAutostart()) {
            log.info("Worker {} not started, scheduler.autostart is false", worker.getWorkerId());
            return;
        }
        worker.start();
    }

    @EventListener(ContextClosedEvent.class)
    public void onClose() {
        if (worker.isRunning()) {
            worker.stop();
        }
    }
}
