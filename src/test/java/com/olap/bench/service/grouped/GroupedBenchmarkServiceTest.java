package com.olap.bench.service.grouped;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.olap.bench.config.BenchProperties;
import com.olap.bench.domain.DimensionEncoder;
import com.olap.bench.domain.GroupedReport;
import com.olap.bench.domain.GroupedRow;
import com.olap.bench.domain.UnknownQuerySetException;
import com.olap.bench.service.dispatch.BatchDispatcher;
import com.olap.bench.support.FakeBitmapEngineClient;
import com.olap.bench.util.MetricsHelper;
import com.olap.bench.util.SlowPayloadLogger;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

class GroupedBenchmarkServiceTest {

    private FakeBitmapEngineClient engine;
    private BenchProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private GroupedQueryCatalog catalog;
    private GroupedBenchmarkService service;

    @BeforeEach
    void setUp() {
        engine = new FakeBitmapEngineClient();
        properties = new BenchProperties();
        properties.getGrouped().setDefaultConcurrency(4);
        meterRegistry = new SimpleMeterRegistry();
        MetricsHelper metricsHelper = new MetricsHelper(meterRegistry);
        SlowPayloadLogger slowPayloadLogger = new SlowPayloadLogger(metricsHelper);
        ReflectionTestUtils.setField(slowPayloadLogger, "thresholdMs", 60_000L);
        ReflectionTestUtils.setField(slowPayloadLogger, "previewChars", 200);

        catalog = new GroupedQueryCatalog(DimensionEncoder.standard());
        service = new GroupedBenchmarkService(
            catalog,
            new BatchDispatcher(engine, properties, metricsHelper, slowPayloadLogger,
                OpenTelemetry.noop().getTracer("test")),
            properties,
            metricsHelper);
    }

    @Test
    @DisplayName("Each group is queried once and rows come back in the family order")
    void run_ShouldReturnSortedRowsWithEngineValues() {
        // When
        GroupedReport report = service.run("3.3", 8);

        // Then
        assertThat(report.family()).isEqualTo("3.3");
        assertThat(report.concurrency()).isEqualTo(8);
        assertThat(report.rowCount()).isEqualTo(24);
        assertThat(report.failedCount()).isZero();
        assertThat(engine.calls()).isEqualTo(24);
        assertThat(engine.payloadSizes()).containsOnly(1);

        GroupedFamily family = catalog.get("3.3");
        assertThat(report.rows()).allSatisfy(row ->
            assertThat(row.getResult()).isEqualTo(FakeBitmapEngineClient.valueOf(family.queryFor(row))));

        List<GroupedRow> resorted = new ArrayList<>(report.rows());
        resorted.sort(GroupedRowComparators.BY_YEAR_RESULT_DESC);
        assertThat(report.rows()).containsExactlyElementsOf(resorted);
        assertThat(report.rows().get(0).getYear()).isEqualTo(1992);
    }

    @Test
    void run_ShouldUseDefaultConcurrency() {
        GroupedReport report = service.run("2.3");

        assertThat(report.concurrency()).isEqualTo(4);
        assertThat(report.rows()).extracting(GroupedRow::getYear)
            .containsExactly(1992, 1993, 1994, 1995, 1996, 1997, 1998);
    }

    @Test
    void run_ShouldKeepFailedGroupsWithReason() {
        // Given
        engine.failWhen(statement -> statement.contains("frame=\"c_city\", rowID=181)"), "engine error: boom");

        // When
        GroupedReport report = service.run("3.3", 4);

        // Then
        assertThat(report.rowCount()).isEqualTo(24);
        assertThat(report.failedCount()).isEqualTo(12);
        assertThat(report.rows())
            .filteredOn(GroupedRow::isFailed)
            .allSatisfy(row -> {
                assertThat(row.getCCity()).isEqualTo("UNITED KI1");
                assertThat(row.getResult()).isNull();
                assertThat(row.getFailureReason()).contains("boom");
            });
    }

    @Test
    void run_ShouldRecordGroupedMetric() {
        service.run("4.1", 2);

        assertThat(meterRegistry.get("bench.grouped.duration").tag("family", "4.1").timer().count()).isEqualTo(1);
    }

    @Test
    void run_ShouldRejectUnknownFamilyAndInvalidConcurrency() {
        assertThatThrownBy(() -> service.run("1.1", 1))
            .isInstanceOf(UnknownQuerySetException.class);
        assertThatThrownBy(() -> service.run("3.3", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void familyNames_ShouldExposeCatalog() {
        assertThat(service.familyNames()).contains("2.1", "4.3").hasSize(10);
    }
}
