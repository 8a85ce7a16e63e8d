package com.decisionledger.engine;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

/**
 * The decision logic itself failed.
 */
public class DecisionExecutionException extends DecisionLedgerException {

    public DecisionExecutionException(String key, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, key + " failed: " + cause.getMessage(), cause);
    }
}
