package com.olap.bench.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import com.olap.bench.config.BenchProperties;
import com.olap.bench.domain.BenchmarkResult;
import com.olap.bench.domain.DimensionEncoder;
import com.olap.bench.domain.UnknownQuerySetException;
import com.olap.bench.service.dispatch.BatchDispatcher;
import com.olap.bench.service.report.ResultLogWriter;
import com.olap.bench.support.FakeBitmapEngineClient;
import com.olap.bench.util.MetricsHelper;
import com.olap.bench.util.SlowPayloadLogger;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

/**
 * Benchmark runs end to end against an in-memory engine.
 */
class BenchmarkServiceTest {

    private static final long RECORDS = 5 * FakeBitmapEngineClient.RECORDS_PER_MFGR;

    @TempDir
    Path resultsDir;

    private FakeBitmapEngineClient engine;
    private BenchProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private BenchmarkService service;

    @BeforeEach
    void setUp() {
        engine = new FakeBitmapEngineClient();
        properties = new BenchProperties();
        properties.getResults().setDirectory(resultsDir.toString());
        properties.getSweep().setConcurrencyLevels(List.of(1, 4));
        properties.getSweep().setBatchSizes(List.of(1, 8));

        meterRegistry = new SimpleMeterRegistry();
        MetricsHelper metricsHelper = new MetricsHelper(meterRegistry);
        SlowPayloadLogger slowPayloadLogger = new SlowPayloadLogger(metricsHelper);
        ReflectionTestUtils.setField(slowPayloadLogger, "thresholdMs", 60_000L);
        ReflectionTestUtils.setField(slowPayloadLogger, "previewChars", 200);

        service = new BenchmarkService(
            new QuerySetCatalog(DimensionEncoder.standard()),
            new BatchDispatcher(engine, properties, metricsHelper, slowPayloadLogger,
                OpenTelemetry.noop().getTracer("test")),
            engine,
            new ResultLogWriter(properties),
            metricsHelper,
            properties);
    }

    @Test
    void runMultiBatch_ShouldReportEveryQueryAndPersistValues() throws Exception {
        // When
        BenchmarkResult result = service.runMultiBatch("test", 4, 8);

        // Then
        assertThat(result.name()).isEqualTo("test");
        assertThat(result.iterations()).isEqualTo(72);
        assertThat(result.concurrency()).isEqualTo(4);
        assertThat(result.batchSize()).isEqualTo(8);
        assertThat(result.resultCount()).isEqualTo(72);
        assertThat(result.failedCount()).isZero();
        assertThat(result.isComplete()).isTrue();
        assertThat(result.columnCount()).isEqualTo(RECORDS);
        assertThat(result.seconds()).isGreaterThanOrEqualTo(0.0);

        Path file = Path.of(result.resultFile());
        assertThat(file.getFileName().toString()).isEqualTo("test-" + result.timestamp() + ".txt");
        assertThat(Files.readAllLines(file)).hasSize(72).allMatch(line -> line.matches("\\d+"));
    }

    @Test
    @DisplayName("Without a concurrency the whole grid runs, concurrency in the outer loop")
    void run_ShouldSweepWhenConcurrencyIsMissing() {
        List<BenchmarkResult> results = service.run("2.3", null, 1);

        assertThat(results).hasSize(4);
        assertThat(results).extracting(BenchmarkResult::concurrency).containsExactly(1, 1, 4, 4);
        assertThat(results).extracting(BenchmarkResult::batchSize).containsExactly(1, 8, 1, 8);
        assertThat(results).allMatch(BenchmarkResult::isComplete);
        assertThat(service.run("2.3", 0, 1)).hasSize(4);
    }

    @Test
    void run_ShouldRunOnceWhenConcurrencyIsGiven() {
        List<BenchmarkResult> results = service.run("3.3", 2, 5);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.concurrency()).isEqualTo(2);
            assertThat(result.resultCount()).isEqualTo(24);
        });
        assertThat(meterRegistry.get("bench.run.duration").tag("query", "3.3").timer().count()).isEqualTo(1);
    }

    @Test
    void run_ShouldCountFailedStatementsAndKeepGoing() throws Exception {
        // Given: the payloads holding year 1995 fail
        engine.failWhen(statement -> statement.contains("frame=\"lo_year\", rowID=3)"), "engine error: boom");

        // When
        BenchmarkResult result = service.runMultiBatch("test", 3, 4);

        // Then
        assertThat(result.failedCount()).isPositive();
        assertThat(result.resultCount() + result.failedCount()).isEqualTo(72);
        assertThat(result.isComplete()).isFalse();
        assertThat(Files.readAllLines(Path.of(result.resultFile()))).hasSize((int) result.resultCount());
    }

    @Test
    void run_ShouldSkipResultFileWhenDisabled() {
        properties.getResults().setEnabled(false);

        BenchmarkResult result = service.runMultiBatch("1.1", 1, 1);

        assertThat(result.resultFile()).isNull();
        assertThat(result.resultCount()).isEqualTo(1);
    }

    @Test
    void recordCount_ShouldBeReadOnceAndCached() {
        service.runMultiBatch("2.3", 1, 7);
        service.runMultiBatch("2.3", 1, 7);

        // two runs of one payload each plus a single count query
        assertThat(engine.calls()).isEqualTo(3);
    }

    @Test
    void recordCount_ShouldNotCacheFailures() {
        engine.failWhen(statement -> statement.startsWith("Count("), "engine error: count");
        assertThat(service.recordCount()).isZero();

        engine.reset();

        assertThat(service.recordCount()).isEqualTo(RECORDS);
    }

    @Test
    void version_ShouldReportServiceAndEngineVersions() {
        properties.setVersion("v1.0.0");
        engine.withVersion("v0.9.3");

        assertThat(service.version()).isEqualTo(new BenchmarkService.VersionInfo("v1.0.0", "v0.9.3"));

        engine.withVersion(null);
        assertThat(service.version().engineVersion()).isEqualTo("unknown");
    }

    @Test
    void querySets_ShouldDescribeSizesAndCardinalities() {
        assertThat(service.querySets())
            .filteredOn(info -> info.name().equals("test"))
            .singleElement()
            .satisfies(info -> {
                assertThat(info.iterations()).isEqualTo(72);
                assertThat(info.cardinalities()).containsExactly(6, 4, 3);
            });
    }

    @Test
    void run_ShouldRejectUnknownQuerySetAndInvalidSizes() {
        assertThatThrownBy(() -> service.runMultiBatch("nope", 1, 1))
            .isInstanceOf(UnknownQuerySetException.class);
        assertThatThrownBy(() -> service.runMultiBatch("test", -1, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.runMultiBatch("test", 1, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
