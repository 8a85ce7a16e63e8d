package com.decisionledger.engine;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

import java.time.Instant;

public class InactiveFunctionException extends DecisionLedgerException {

    public InactiveFunctionException(String functionId, String version, Instant asOf) {
        super(ErrorCode.INACTIVE_FUNCTION, (version == null ? functionId : functionId + "@" + version)
            + " is not in force at " + asOf);
    }

    public InactiveFunctionException(String message) {
        super(ErrorCode.INACTIVE_FUNCTION, message);
    }
}
