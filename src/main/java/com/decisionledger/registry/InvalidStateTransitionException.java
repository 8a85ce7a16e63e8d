package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

public class InvalidStateTransitionException extends DecisionLedgerException {

    public InvalidStateTransitionException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
    }

    public InvalidStateTransitionException(String key, FunctionStatus from, String operation) {
        super(ErrorCode.INVALID_STATE_TRANSITION, "cannot " + operation + " " + key + " in status " + from);
    }
}
