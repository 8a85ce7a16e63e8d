package com.decisionledger.common;

/**
 * Machine-readable failure codes. Recorded verbatim on ERROR trace records.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    INACTIVE_FUNCTION,
    VERSION_NOT_FOUND,
    EXECUTION_TIMEOUT,
    EXECUTION_ERROR,
    EXECUTION_CANCELLED,
    DUPLICATE_VERSION,
    SEPARATION_OF_DUTIES,
    RULE_CONFLICT,
    LEGAL_REFERENCE,
    INVALID_STATE_TRANSITION,
    INVALID_SIGNATURE,
    CONCURRENT_MODIFICATION,
    EXTERNAL_DEPENDENCY,
    CHAIN_INTEGRITY,
    DUPLICATE_TRACE,
    DETERMINISM_VIOLATION,
    REPLAY_UNAVAILABLE
}
