package com.olap.bench.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry tracing.
 *
 * Spans are produced when the OpenTelemetry Java agent is attached:
 * <pre>
 * java -javaagent:opentelemetry-javaagent.jar \
 *      -Dotel.service.name=olap-bench -jar olap-bench.jar
 * </pre>
 * The agent picks up {@code @WithSpan} on service entry points and on
 * engine calls. Without the agent {@link GlobalOpenTelemetry} is a no-op
 * and tracing costs nothing.
 *
 * @see com.olap.bench.util.CorrelationIdFilter
 */
@Configuration
public class TracingConfig {

    @Bean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    /**
     * Tracer for spans created programmatically, e.g. one span per payload.
     */
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("com.olap.bench", "1.0.0");
    }
}
