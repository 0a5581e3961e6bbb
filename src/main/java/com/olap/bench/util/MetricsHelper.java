package com.olap.bench.util;

import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Benchmark metrics on top of Micrometer.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * <ul>
 *   <li>{@code bench.payload.duration} (timer): engine call latency per payload, by query set and status</li>
 *   <li>{@code bench.payload.count} (counter): payloads sent, by query set and status</li>
 *   <li>{@code bench.statement.failures} (counter): statements reported as failed, by query set and reason</li>
 *   <li>{@code bench.run.duration} (timer): full dispatch runs, by query set, concurrency and batch size</li>
 *   <li>{@code bench.grouped.duration} (timer): grouped runs, by family</li>
 *   <li>{@code bench.slow_payload.count} (counter): payloads above the slow threshold</li>
 * </ul>
 *
 * Query set names are a small fixed catalog, so they are safe as tag values.
 *
 * @see com.olap.bench.config.ObservabilityConfig
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private static final String PREFIX = "bench";

    private final MeterRegistry meterRegistry;

    /**
     * Records one engine call.
     *
     * @param queryName query set or grouped family name
     * @param statements statements in the payload
     * @param success whether the engine answered
     * @param durationMs engine call duration
     */
    public void recordPayload(String queryName, int statements, boolean success, long durationMs) {
        String status = success ? "success" : "failure";

        Counter.builder(PREFIX + ".payload.count")
            .tag("query", queryName)
            .tag("status", status)
            .description("Engine calls issued by dispatch workers")
            .register(meterRegistry)
            .increment();

        Timer.builder(PREFIX + ".payload.duration")
            .tag("query", queryName)
            .tag("status", status)
            .description("Engine call latency per payload")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);

        log.trace("Payload recorded: query={}, statements={}, status={}, duration={}ms",
            queryName, statements, status, durationMs);
    }

    /**
     * Records statements that produced no value.
     *
     * @param queryName query set or grouped family name
     * @param reason short failure category, e.g. {@code unsupported_operator}
     * @param statements number of failed statements
     */
    public void recordStatementFailures(String queryName, String reason, int statements) {
        Counter.builder(PREFIX + ".statement.failures")
            .tag("query", queryName)
            .tag("reason", reason)
            .description("Statements whose engine call failed")
            .register(meterRegistry)
            .increment(statements);
    }

    /**
     * Records a completed dispatch run.
     */
    public void recordRun(String queryName, int concurrency, int batchSize, long durationMs, long failed) {
        Timer.builder(PREFIX + ".run.duration")
            .tag("query", queryName)
            .tag("concurrency", String.valueOf(concurrency))
            .tag("batch_size", String.valueOf(batchSize))
            .tag("complete", String.valueOf(failed == 0))
            .description("Dispatch run duration")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Records a completed grouped run.
     */
    public void recordGroupedRun(String family, int rows, long durationMs) {
        Timer.builder(PREFIX + ".grouped.duration")
            .tag("family", family)
            .description("Grouped benchmark duration including the final sort")
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);

        log.debug("Grouped run recorded: family={}, rows={}, duration={}ms", family, rows, durationMs);
    }

    /**
     * Records a payload that exceeded the slow threshold.
     */
    public void recordSlowPayload(String queryName, long durationMs, long thresholdMs) {
        Counter.builder(PREFIX + ".slow_payload.count")
            .tag("query", queryName)
            .tag("threshold_ms", String.valueOf(thresholdMs))
            .description("Engine calls slower than the configured threshold")
            .register(meterRegistry)
            .increment();
    }
}
