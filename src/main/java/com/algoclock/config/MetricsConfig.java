package com.algoclock.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. The scheduler meters themselves are defined in
 * {@link com.algoclock.observability.SchedulerMetrics}.
 */
@Configuration
public class MetricsConfig {

    // Applied before any meter is registered, so the scheduler meters carry the tag too
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTagsCustomizer() {
        return registry -> registry.config().commonTags("application", "algoclock");
    }
}
