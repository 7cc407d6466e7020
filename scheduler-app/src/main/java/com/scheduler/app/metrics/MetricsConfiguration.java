package com.scheduler.app.metrics;

import com.scheduler.engine.metrics.SchedulerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer setup. {@link SchedulerMetrics} is bound to the registry by Spring Boot
 * as a MeterBinder.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "task-scheduler");
    }

    @Bean
    public SchedulerMetrics schedulerMetrics() {
        return new SchedulerMetrics();
    }
}
