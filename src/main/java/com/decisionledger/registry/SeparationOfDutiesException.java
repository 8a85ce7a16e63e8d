package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

public class SeparationOfDutiesException extends DecisionLedgerException {

    public SeparationOfDutiesException(String message) {
        super(ErrorCode.SEPARATION_OF_DUTIES, message);
    }
}
