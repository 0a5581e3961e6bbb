package com.olap.bench.domain;

/**
 * One per-statement record returned by the engine.
 *
 * @param value the numeric aggregate (sum) of the statement
 * @param count the number of records the aggregate covered
 */
public record EngineResult(long value, long count) {
}
