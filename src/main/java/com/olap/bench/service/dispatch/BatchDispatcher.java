package com.olap.bench.service.dispatch;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.olap.bench.config.BenchProperties;
import com.olap.bench.domain.EngineResult;
import com.olap.bench.domain.FailurePolicy;
import com.olap.bench.domain.Payload;
import com.olap.bench.domain.QueryOutcome;
import com.olap.bench.domain.QueryRow;
import com.olap.bench.domain.QuerySet;
import com.olap.bench.repository.BitmapEngineClient;
import com.olap.bench.repository.EngineCallException;
import com.olap.bench.repository.EngineUnavailableException;
import com.olap.bench.util.MetricsHelper;
import com.olap.bench.util.SlowPayloadLogger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends the queries of a {@link QuerySet} to the engine with a configurable
 * combination of concurrency and batch size:
 * <ul>
 *   <li>concurrency=1, batchSize=size: one monolithic engine call</li>
 *   <li>concurrency=N, batchSize=1: N workers, one query per call</li>
 *   <li>concurrency=N, batchSize=10: N workers sending batches of 10</li>
 * </ul>
 * Every combination yields the same multiset of successful values.
 *
 * Each statement ends up as exactly one {@link QueryOutcome}. A failed engine
 * call never stops the run; what it reports depends on
 * {@code bench.dispatch.failure-policy}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchDispatcher {

    private static final String UNSUPPORTED_OPERATOR_HINT = "engine may not support BETWEEN range queries";

    private final BitmapEngineClient engineClient;
    private final BenchProperties properties;
    private final MetricsHelper metricsHelper;
    private final SlowPayloadLogger slowPayloadLogger;
    private final Tracer tracer;

    /**
     * Starts dispatching a query set. The caller drains the returned pipeline
     * and should close it when done.
     *
     * Payloads are created in ascending index order; outcomes of different
     * payloads arrive in no particular order when concurrency is above 1.
     *
     * @param querySet queries to send
     * @param concurrency number of workers, at least 1
     * @param batchSize queries per engine call, at least 1
     * @return running pipeline of per-statement outcomes
     * @throws IllegalArgumentException if concurrency or batch size is below 1
     */
    public WorkerPipeline<Payload, QueryOutcome> dispatch(QuerySet querySet, int concurrency, int batchSize) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, was " + concurrency);
        }
        PayloadPartitioner payloads = new PayloadPartitioner(querySet, batchSize);

        log.debug("Dispatching {}: {} queries, concurrency={}, batchSize={}, payloads={}",
            querySet.name(), querySet.size(), concurrency, batchSize,
            PayloadPartitioner.payloadCount(querySet.size(), batchSize));

        BenchProperties.Dispatch dispatch = properties.getDispatch();
        return WorkerPipeline.start(
            "dispatch-" + querySet.name(),
            payloads,
            concurrency,
            dispatch.getWorkQueueCapacity(),
            dispatch.getResultQueueCapacity(),
            payload -> execute(querySet.name(), payload));
    }

    /**
     * Sends one payload in a single engine call.
     *
     * @param queryName name used for logging and metrics
     * @param payload statements to send
     * @return one outcome per statement, in payload order
     */
    public List<QueryOutcome> execute(String queryName, Payload payload) {
        Span span = tracer.spanBuilder("dispatch.payload")
            .setAttribute("benchmark.query", queryName)
            .setAttribute("payload.sequence", payload.sequence())
            .setAttribute("payload.statements", payload.size())
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<QueryOutcome> outcomes = send(queryName, payload);
            long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
            span.setAttribute("payload.failed", failed);
            if (failed > 0) {
                span.setStatus(StatusCode.ERROR, failed + " statements failed");
            }
            return outcomes;
        } finally {
            span.end();
        }
    }

    private List<QueryOutcome> send(String queryName, Payload payload) {
        long startTime = System.currentTimeMillis();
        try {
            List<EngineResult> results = engineClient.query(payload.text());
            long durationMs = System.currentTimeMillis() - startTime;

            metricsHelper.recordPayload(queryName, payload.size(), true, durationMs);
            slowPayloadLogger.logIfSlow(queryName, startTime, payload.size(), payload.text());

            return toOutcomes(queryName, payload, results);

        } catch (EngineCallException e) {
            long durationMs = System.currentTimeMillis() - startTime;
            metricsHelper.recordPayload(queryName, payload.size(), false, durationMs);

            if (e.isUnsupportedOperator()) {
                log.warn("{} of {} failed with: {} ({})", payload, queryName, e.getMessage(), UNSUPPORTED_OPERATOR_HINT);
                if (payload.size() > 1 && properties.getDispatch().getFailurePolicy() == FailurePolicy.ISOLATE_STATEMENT) {
                    return isolate(queryName, payload);
                }
            } else {
                log.error("{} of {} failed with: {}", payload, queryName, e.getMessage());
            }

            metricsHelper.recordStatementFailures(queryName, failureCategory(e), payload.size());
            return failAll(payload, e.getMessage());

        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - startTime;
            metricsHelper.recordPayload(queryName, payload.size(), false, durationMs);
            log.error("{} of {} failed unexpectedly", payload, queryName, e);

            metricsHelper.recordStatementFailures(queryName, "engine_error", payload.size());
            return failAll(payload, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static List<QueryOutcome> failAll(Payload payload, String reason) {
        List<QueryOutcome> failures = new ArrayList<>(payload.size());
        for (QueryRow row : payload.rows()) {
            failures.add(QueryOutcome.failure(row, reason));
        }
        return failures;
    }

    private List<QueryOutcome> toOutcomes(String queryName, Payload payload, List<EngineResult> results) {
        List<QueryOutcome> outcomes = new ArrayList<>(payload.size());
        for (int i = 0; i < payload.size(); i++) {
            QueryRow row = payload.rows().get(i);
            if (i < results.size()) {
                outcomes.add(QueryOutcome.success(row, results.get(i).value()));
            } else {
                outcomes.add(QueryOutcome.failure(row, "engine returned no result for this statement"));
            }
        }
        if (results.size() != payload.size()) {
            log.warn("{} of {}: sent {} statements, engine returned {} results",
                payload, queryName, payload.size(), results.size());
            if (results.size() < payload.size()) {
                metricsHelper.recordStatementFailures(queryName, "missing_result", payload.size() - results.size());
            }
        }
        return outcomes;
    }

    private List<QueryOutcome> isolate(String queryName, Payload payload) {
        log.info("Re-issuing {} statements of {} one at a time", payload.size(), payload);
        List<QueryOutcome> outcomes = new ArrayList<>(payload.size());
        for (QueryRow row : payload.rows()) {
            outcomes.addAll(execute(queryName, new Payload(payload.sequence(), List.of(row))));
        }
        return outcomes;
    }

    private static String failureCategory(EngineCallException e) {
        if (e instanceof EngineUnavailableException) {
            return "engine_unavailable";
        }
        return e.isUnsupportedOperator() ? "unsupported_operator" : "engine_error";
    }
}
