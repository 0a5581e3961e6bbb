package com.olap.bench.domain;

/**
 * What a dispatch run reports when a multi-statement payload fails.
 */
public enum FailurePolicy {

    /** Every statement of the failed payload is reported as failed. */
    DROP_PAYLOAD,

    /**
     * A payload rejected for an unsupported operator is re-issued one
     * statement at a time, so only the offending statements fail. Other
     * errors still fail the whole payload.
     */
    ISOLATE_STATEMENT
}
