package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

public class InvalidSignatureException extends DecisionLedgerException {

    public InvalidSignatureException(String key, String signerId, SignerRole role) {
        super(ErrorCode.INVALID_SIGNATURE, role + " signature of " + signerId + " does not verify for " + key);
    }
}
