package com.olap.bench.domain;

import java.util.List;

/**
 * Sorted output of one grouped benchmark run.
 *
 * @param family query family name, e.g. {@code 3.2}
 * @param concurrency number of workers used
 * @param seconds wall-clock duration including the final sort
 * @param timestamp unix time at which the run finished
 * @param failedCount rows whose query failed
 * @param rows all rows, ordered by the family's ORDER BY
 */
public record GroupedReport(
    String family,
    int concurrency,
    double seconds,
    long timestamp,
    long failedCount,
    List<GroupedRow> rows
) {
    public GroupedReport {
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }
}
