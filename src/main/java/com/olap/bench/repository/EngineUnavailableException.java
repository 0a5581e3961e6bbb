package com.olap.bench.repository;

/**
 * The engine could not be reached. Unlike other {@link EngineCallException}s
 * this is transient and worth retrying.
 */
public class EngineUnavailableException extends EngineCallException {

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
