package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

public class DuplicateVersionException extends DecisionLedgerException {

    public DuplicateVersionException(String functionId, String version) {
        super(ErrorCode.DUPLICATE_VERSION, functionId + "@" + version + " is already registered; publish a new version");
    }
}
