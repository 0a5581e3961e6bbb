package com.olap.bench.config;

import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer setup for the benchmark service.
 *
 * Benchmark metrics (payload latency, failures, run durations) are recorded
 * by {@link com.olap.bench.util.MetricsHelper} and exposed with the JVM and
 * HTTP server metrics at /actuator/prometheus and /api/metrics.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ObservabilityConfig {

    private final Environment environment;

    /**
     * Adds the application and environment tags to every meter.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        String appName = environment.getProperty("spring.application.name", "olap-bench");
        String env = environment.getProperty("ENVIRONMENT", "dev");

        log.info("Configuring metrics with tags: application={}, environment={}", appName, env);

        return registry -> registry.config()
            .commonTags(
                "application", appName,
                "environment", env
            )
            .meterFilter(MeterFilter.maximumAllowableMetrics(10000));
    }

    /**
     * Enables {@code @Timed} on service methods.
     */
    @Bean
    public TimedAspect timedAspect(MeterRegistry registry) {
        log.info("Enabling @Timed annotation support for method-level metrics");
        return new TimedAspect(registry);
    }

    /**
     * Caps the number of distinct request URIs; every query set name is a
     * separate URI.
     */
    @Bean
    public MeterFilter httpUriCardinalityFilter() {
        return MeterFilter.maximumAllowableTags(
            "http.server.requests",
            "uri",
            200,
            MeterFilter.deny()
        );
    }
}
