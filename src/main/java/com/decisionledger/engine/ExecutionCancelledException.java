package com.decisionledger.engine;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

/**
 * The calling thread was interrupted before the decision completed. The
 * interrupt status of the caller is preserved.
 */
public class ExecutionCancelledException extends DecisionLedgerException {

    public ExecutionCancelledException(String key) {
        super(ErrorCode.EXECUTION_CANCELLED, "execution of " + key + " was cancelled");
    }
}
