package com.olap.bench.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one completed dispatch run, the unit of reporting.
 *
 * The first seven fields keep the wire names existing dashboards read
 * ({@code batchsize}, {@code columncount}). A {@code resultCount} lower than
 * {@code iterations} means some statements failed; callers should not treat
 * a finished run as a complete one.
 *
 * @param name query set name
 * @param iterations number of queries in the set
 * @param concurrency number of workers
 * @param batchSize queries per engine call
 * @param seconds wall-clock duration of the run
 * @param columnCount number of records scanned by each query (lineorder rows)
 * @param timestamp unix time at which dispatching started
 * @param resultCount statements that produced a value
 * @param failedCount statements whose engine call failed
 * @param resultFile path of the persisted result log, null if none was written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BenchmarkResult(
    @JsonProperty("name") String name,
    @JsonProperty("iterations") long iterations,
    @JsonProperty("concurrency") int concurrency,
    @JsonProperty("batchsize") int batchSize,
    @JsonProperty("seconds") double seconds,
    @JsonProperty("columncount") long columnCount,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("resultcount") long resultCount,
    @JsonProperty("failedcount") long failedCount,
    @JsonProperty("resultfile") String resultFile
) {
    @JsonIgnore
    public boolean isComplete() {
        return failedCount == 0 && resultCount == iterations;
    }
}
