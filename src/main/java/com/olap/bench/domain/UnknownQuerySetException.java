package com.olap.bench.domain;

/**
 * Thrown when a requested query set or grouped family does not exist.
 */
public class UnknownQuerySetException extends RuntimeException {

    private final String queryName;

    public UnknownQuerySetException(String queryName) {
        super("Unknown query set: " + queryName);
        this.queryName = queryName;
    }

    public String getQueryName() {
        return queryName;
    }
}
