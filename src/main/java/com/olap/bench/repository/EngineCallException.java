package com.olap.bench.repository;

/**
 * The engine rejected a request or returned an unusable response.
 */
public class EngineCallException extends RuntimeException {

    /**
     * Substring of the engine error returned for range operators it does not
     * implement, such as {@code ><} (BETWEEN).
     */
    public static final String UNSUPPORTED_OPERATOR_MARKER = "invalid argument value";

    public EngineCallException(String message) {
        super(message);
    }

    public EngineCallException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isUnsupportedOperator() {
        return getMessage() != null && getMessage().contains(UNSUPPORTED_OPERATOR_MARKER);
    }
}
