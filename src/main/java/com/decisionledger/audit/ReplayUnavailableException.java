package com.decisionledger.audit;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

public class ReplayUnavailableException extends DecisionLedgerException {

    private final String traceId;

    public ReplayUnavailableException(String traceId, String reason) {
        super(ErrorCode.REPLAY_UNAVAILABLE, "cannot replay " + traceId + ": " + reason);
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }
}
