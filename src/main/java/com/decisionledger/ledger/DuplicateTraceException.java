package com.decisionledger.ledger;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

/**
 * Thrown when a record is appended with a trace_id the ledger already holds.
 * The trace_id is the idempotency key of an append.
 */
public class DuplicateTraceException extends DecisionLedgerException {

    public DuplicateTraceException(String traceId) {
        super(ErrorCode.DUPLICATE_TRACE, "trace_id already exists: " + traceId);
    }
}
