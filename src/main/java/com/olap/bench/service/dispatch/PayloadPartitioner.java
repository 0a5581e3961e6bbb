package com.olap.bench.service.dispatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.olap.bench.domain.Payload;
import com.olap.bench.domain.QueryRow;
import com.olap.bench.domain.QuerySet;

/**
 * Walks a {@link QuerySet} in ascending index order and groups consecutive
 * queries into payloads of {@code batchSize}; the last payload may be shorter.
 *
 * Queries are materialized lazily, one payload at a time.
 */
public final class PayloadPartitioner implements Iterator<Payload> {

    private final QuerySet querySet;
    private final int batchSize;
    private long nextIndex;
    private long nextSequence;

    public PayloadPartitioner(QuerySet querySet, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, was " + batchSize);
        }
        this.querySet = querySet;
        this.batchSize = batchSize;
    }

    /**
     * Number of payloads a query set of {@code size} queries splits into.
     */
    public static long payloadCount(long size, int batchSize) {
        return (size + batchSize - 1) / batchSize;
    }

    @Override
    public boolean hasNext() {
        return nextIndex < querySet.size();
    }

    @Override
    public Payload next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        long end = Math.min(nextIndex + batchSize, querySet.size());
        List<QueryRow> rows = new ArrayList<>((int) (end - nextIndex));
        for (long n = nextIndex; n < end; n++) {
            rows.add(querySet.rowAt(n));
        }
        nextIndex = end;
        return new Payload(nextSequence++, rows);
    }
}
