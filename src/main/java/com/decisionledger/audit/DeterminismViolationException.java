package com.decisionledger.audit;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

/**
 * Replaying a decision against its own version produced a different output.
 * This is a correctness bug in the function or the engine.
 */
public class DeterminismViolationException extends DecisionLedgerException {

    private final DriftReport report;

    public DeterminismViolationException(DriftReport report) {
        super(ErrorCode.DETERMINISM_VIOLATION, "replay of " + report.traceId() + " against "
            + report.functionId() + "@" + report.replayedVersion() + " diverged: expected "
            + report.originalOutputHash() + " but got " + report.replayedOutputHash()
            + (report.replayError() == null ? "" : " (" + report.replayError() + ")"));
        this.report = report;
    }

    public DriftReport getReport() {
        return report;
    }
}
