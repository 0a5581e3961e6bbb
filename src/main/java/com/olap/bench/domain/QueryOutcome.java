package com.olap.bench.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of one statement of a dispatch run, either a value or a failure.
 *
 * A failed cell is reported explicitly so a true zero sum can be told apart
 * from a query that never produced a value.
 */
public final class QueryOutcome {

    private final QueryRow row;
    private final Long value;
    private final String failureReason;

    private QueryOutcome(QueryRow row, Long value, String failureReason) {
        this.row = Objects.requireNonNull(row, "row");
        this.value = value;
        this.failureReason = failureReason;
    }

    public static QueryOutcome success(QueryRow row, long value) {
        return new QueryOutcome(row.withOutputs(List.of(value)), value, null);
    }

    public static QueryOutcome failure(QueryRow row, String reason) {
        return new QueryOutcome(row, null, reason != null ? reason : "unknown failure");
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public long index() {
        return row.index();
    }

    public QueryRow row() {
        return row;
    }

    /**
     * @return the aggregate value
     * @throws IllegalStateException if this outcome is a failure
     */
    public long value() {
        if (value == null) {
            throw new IllegalStateException("Query " + row.index() + " failed: " + failureReason);
        }
        return value;
    }

    public String failureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "<query " + row.index() + " = " + value + ">"
            : "<query " + row.index() + " failed: " + failureReason + ">";
    }
}
