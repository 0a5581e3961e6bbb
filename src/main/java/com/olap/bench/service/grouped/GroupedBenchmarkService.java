package com.olap.bench.service.grouped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.olap.bench.config.BenchProperties;
import com.olap.bench.domain.GroupedReport;
import com.olap.bench.domain.GroupedRow;
import com.olap.bench.domain.Payload;
import com.olap.bench.domain.QueryOutcome;
import com.olap.bench.domain.QueryRow;
import com.olap.bench.service.dispatch.BatchDispatcher;
import com.olap.bench.service.dispatch.WorkerPipeline;
import com.olap.bench.util.MetricsHelper;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a grouped query family: one point query per group key, issued by a
 * worker pool, then the family's ORDER BY applied to the collected rows.
 *
 * Rows whose query failed stay in the report with a failure reason, so a
 * missing group is never mistaken for a zero sum.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupedBenchmarkService {

    private final GroupedQueryCatalog catalog;
    private final BatchDispatcher dispatcher;
    private final BenchProperties properties;
    private final MetricsHelper metricsHelper;

    public List<String> familyNames() {
        return catalog.names();
    }

    /**
     * Runs a family with the configured default concurrency.
     */
    public GroupedReport run(String familyName) {
        return run(familyName, properties.getGrouped().getDefaultConcurrency());
    }

    /**
     * Runs a family.
     *
     * @param familyName e.g. {@code 3.2}
     * @param concurrency number of workers, at least 1
     * @return all rows of the family, sorted
     * @throws com.olap.bench.domain.UnknownQuerySetException if the family does not exist
     * @throws IllegalArgumentException if concurrency is below 1
     */
    @WithSpan("benchmark.grouped")
    public GroupedReport run(String familyName, int concurrency) {
        GroupedFamily family = catalog.get(familyName);
        Span.current().setAttribute("benchmark.family", familyName);
        Span.current().setAttribute("benchmark.concurrency", concurrency);

        log.info("Grouped run {} started: {} groups by ({}), concurrency={}",
            familyName, family.size(), family.groupBy(), concurrency);

        long startTime = System.nanoTime();
        BenchProperties.Dispatch dispatch = properties.getDispatch();

        List<GroupedRow> rows = new ArrayList<>(family.size());
        try (WorkerPipeline<GroupedRow, GroupedRow> pipeline = WorkerPipeline.start(
                "grouped-" + familyName,
                family.keys().iterator(),
                concurrency,
                dispatch.getWorkQueueCapacity(),
                dispatch.getResultQueueCapacity(),
                key -> List.of(query(family, key)))) {
            for (GroupedRow row : pipeline) {
                rows.add(row);
            }
        }

        rows.sort(family.order());

        long durationNanos = System.nanoTime() - startTime;
        long failed = rows.stream().filter(GroupedRow::isFailed).count();
        metricsHelper.recordGroupedRun(familyName, rows.size(), durationNanos / 1_000_000);

        if (failed > 0) {
            log.warn("Grouped run {} finished with {} of {} groups failed", familyName, failed, rows.size());
        }
        if (log.isDebugEnabled()) {
            rows.forEach(row -> log.debug("{}", row));
        }
        log.info("query {}: {} sec", familyName, durationNanos / 1e9);

        return new GroupedReport(familyName, concurrency, durationNanos / 1e9,
            Instant.now().getEpochSecond(), failed, rows);
    }

    private GroupedRow query(GroupedFamily family, GroupedRow key) {
        QueryRow row = new QueryRow(0, family.queryFor(key), List.of(), List.of());
        QueryOutcome outcome = dispatcher.execute(family.name(), new Payload(0, List.of(row))).get(0);
        return outcome.isSuccess()
            ? key.withResult(outcome.value())
            : key.withFailureReason(outcome.failureReason());
    }
}
