package com.olap.bench.domain;

import java.util.List;

/**
 * One materialized query of a {@link QuerySet}: its linear index, raw text,
 * input tuple and output scalars.
 */
public record QueryRow(
    long index,
    String raw,
    List<QueryArgument> inputs,
    List<Long> outputs
) {
    public QueryRow {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public QueryRow withOutputs(List<Long> values) {
        return new QueryRow(index, raw, inputs, values);
    }
}
