package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

public class ConcurrentReleaseModificationException extends DecisionLedgerException {

    public ConcurrentReleaseModificationException(String key) {
        super(ErrorCode.CONCURRENT_MODIFICATION, key + " was modified concurrently; reload and retry");
    }
}
