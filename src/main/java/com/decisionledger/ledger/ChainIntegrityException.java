package com.decisionledger.ledger;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

/**
 * The recomputed hash chain disagrees with the stored one. Appends at the tail
 * continue; the reported window needs investigation.
 */
public class ChainIntegrityException extends DecisionLedgerException {

    private final IntegrityReport report;

    public ChainIntegrityException(IntegrityReport report) {
        super(ErrorCode.CHAIN_INTEGRITY, "ledger chain broken at sequence " + report.firstBrokenSequence()
            + " (trace_id " + report.firstBrokenTraceId() + ")");
        this.report = report;
    }

    public IntegrityReport getReport() {
        return report;
    }
}
