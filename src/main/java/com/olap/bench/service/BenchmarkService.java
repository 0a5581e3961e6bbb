package com.olap.bench.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.olap.bench.config.BenchProperties;
import com.olap.bench.domain.BenchmarkResult;
import com.olap.bench.domain.Payload;
import com.olap.bench.domain.QueryOutcome;
import com.olap.bench.domain.QuerySet;
import com.olap.bench.repository.BitmapEngineClient;
import com.olap.bench.repository.EngineCallException;
import com.olap.bench.service.dispatch.BatchDispatcher;
import com.olap.bench.service.dispatch.WorkerPipeline;
import com.olap.bench.service.report.ResultLogWriter;
import com.olap.bench.util.MetricsHelper;

import io.micrometer.core.annotation.Timed;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.SpanAttribute;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs monolithic query sets through the {@link BatchDispatcher} and reports
 * throughput.
 *
 * Successful values are streamed to the result log while the run is in
 * progress; failed statements are only counted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BenchmarkService {

    private final QuerySetCatalog catalog;
    private final BatchDispatcher dispatcher;
    private final BitmapEngineClient engineClient;
    private final ResultLogWriter resultLogWriter;
    private final MetricsHelper metricsHelper;
    private final BenchProperties properties;

    private volatile Long recordCount;

    /**
     * Runs one query set once, or the whole concurrency by batch size grid.
     *
     * @param name query set name
     * @param concurrency workers; null or 0 runs the sweep
     * @param batchSize queries per engine call, used when concurrency is given
     * @return one result per run
     */
    @Timed(value = "bench.request", description = "Benchmark requests, single runs and sweeps")
    public List<BenchmarkResult> run(String name, Integer concurrency, int batchSize) {
        if (concurrency == null || concurrency == 0) {
            return sweep(name);
        }
        return List.of(runMultiBatch(name, concurrency, batchSize));
    }

    /**
     * Runs a query set with every combination of the configured concurrency
     * levels and batch sizes, concurrency in the outer loop.
     */
    public List<BenchmarkResult> sweep(String name) {
        QuerySet querySet = catalog.get(name);
        BenchProperties.Sweep sweep = properties.getSweep();

        log.info("Sweep over {}: concurrency {} x batch size {}",
            name, sweep.getConcurrencyLevels(), sweep.getBatchSizes());

        List<BenchmarkResult> results = new ArrayList<>();
        for (int concurrency : sweep.getConcurrencyLevels()) {
            for (int batchSize : sweep.getBatchSizes()) {
                results.add(run(querySet, concurrency, batchSize));
            }
        }
        return results;
    }

    /**
     * Sends every query of a set to the engine.
     *
     * @throws com.olap.bench.domain.UnknownQuerySetException if the set does not exist
     * @throws IllegalArgumentException if concurrency or batch size is below 1
     */
    public BenchmarkResult runMultiBatch(String name, int concurrency, int batchSize) {
        return run(catalog.get(name), concurrency, batchSize);
    }

    @WithSpan("benchmark.run")
    public BenchmarkResult run(
            QuerySet querySet,
            @SpanAttribute("benchmark.concurrency") int concurrency,
            @SpanAttribute("benchmark.batch_size") int batchSize) {

        Span.current().setAttribute("benchmark.query", querySet.name());
        long startTime = System.nanoTime();
        long succeeded = 0;
        long failed = 0;
        String resultFile = null;
        long timestamp;

        try (WorkerPipeline<Payload, QueryOutcome> pipeline =
                 dispatcher.dispatch(querySet, concurrency, batchSize)) {

            timestamp = Instant.now().getEpochSecond();
            ResultLogWriter.ResultLog resultLog = resultLogWriter.open(querySet.name(), timestamp).orElse(null);
            try {
                for (QueryOutcome outcome : pipeline) {
                    if (outcome.isSuccess()) {
                        succeeded++;
                        if (resultLog != null) {
                            resultLog.append(outcome.value());
                        }
                    } else {
                        failed++;
                    }
                }
            } finally {
                if (resultLog != null) {
                    resultLog.close();
                    if (resultLog.isHealthy()) {
                        resultFile = resultLog.path().toString();
                    }
                }
            }
        }

        long durationNanos = System.nanoTime() - startTime;
        double seconds = durationNanos / 1e9;
        metricsHelper.recordRun(querySet.name(), concurrency, batchSize, durationNanos / 1_000_000, failed);

        Span.current().setAttribute("benchmark.failed", failed);
        if (failed > 0) {
            log.warn("Run {} (concurrency={}, batchSize={}): {} of {} statements failed",
                querySet.name(), concurrency, batchSize, failed, querySet.size());
        }
        log.info("Run {} (concurrency={}, batchSize={}): {} queries in {} sec",
            querySet.name(), concurrency, batchSize, succeeded, seconds);

        return new BenchmarkResult(
            querySet.name(),
            querySet.size(),
            concurrency,
            batchSize,
            seconds,
            recordCount(),
            timestamp,
            succeeded,
            failed,
            resultFile);
    }

    /**
     * @return every query set with its size and dimension cardinalities
     */
    public List<QuerySetInfo> querySets() {
        return catalog.all().stream()
            .map(querySet -> new QuerySetInfo(querySet.name(), querySet.size(), toList(querySet.cardinalities())))
            .collect(Collectors.toList());
    }

    public VersionInfo version() {
        return new VersionInfo(properties.getVersion(), engineVersion().orElse("unknown"));
    }

    /**
     * @return the engine's version, empty if the engine did not answer
     */
    public Optional<String> engineVersion() {
        return engineClient.version();
    }

    /**
     * Number of lineorder records, read from the engine on first use.
     * Not cached when the engine cannot answer, so a later run retries.
     */
    long recordCount() {
        Long count = recordCount;
        if (count != null) {
            return count;
        }
        synchronized (this) {
            if (recordCount == null) {
                try {
                    recordCount = engineClient.countRecords();
                    log.info("lineorder count: {}", recordCount);
                } catch (EngineCallException e) {
                    log.warn("Could not count records: {}", e.getMessage());
                    return 0L;
                }
            }
            return recordCount;
        }
    }

    private static List<Integer> toList(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int value : values) {
            list.add(value);
        }
        return list;
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record QuerySetInfo(String name, long iterations, List<Integer> cardinalities) {}

    public record VersionInfo(
        @JsonProperty("demoversion") String demoVersion,
        @JsonProperty("engineversion") String engineVersion
    ) {}
}
