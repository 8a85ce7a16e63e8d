package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

import java.time.Instant;

public class VersionNotFoundException extends DecisionLedgerException {

    public VersionNotFoundException(String functionId, String version) {
        super(ErrorCode.VERSION_NOT_FOUND, "no version " + version + " of " + functionId);
    }

    public VersionNotFoundException(String functionId, Instant asOf) {
        super(ErrorCode.VERSION_NOT_FOUND, "no version of " + functionId + " is effective at " + asOf);
    }
}
