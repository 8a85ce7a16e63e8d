package com.decisionledger.engine;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

import java.time.Duration;

public class ExecutionTimeoutException extends DecisionLedgerException {

    public ExecutionTimeoutException(String key, Duration timeout) {
        this(key, "did not finish within " + timeout.toMillis() + "ms");
    }

    public ExecutionTimeoutException(String key, String reason) {
        super(ErrorCode.EXECUTION_TIMEOUT, key + " " + reason);
    }
}
