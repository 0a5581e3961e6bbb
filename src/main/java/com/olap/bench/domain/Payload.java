package com.olap.bench.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more consecutive queries of a {@link QuerySet} sent to the engine in
 * a single call.
 *
 * @param sequence zero-based creation order of this payload within a run
 * @param rows the materialized queries, in ascending index order
 */
public record Payload(long sequence, List<QueryRow> rows) {

    public Payload {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Payload must contain at least one query");
        }
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public long firstIndex() {
        return rows.get(0).index();
    }

    public long lastIndex() {
        return rows.get(rows.size() - 1).index();
    }

    /** Newline-joined query texts, the body of one engine call. */
    public String text() {
        return rows.stream().map(QueryRow::raw).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "Payload#" + sequence + "[" + firstIndex() + ".." + lastIndex() + "]";
    }
}
