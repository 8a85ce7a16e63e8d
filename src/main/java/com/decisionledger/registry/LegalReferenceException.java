package com.decisionledger.registry;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

import java.util.List;

/**
 * Metadata cites legal references the legal reference service does not accept.
 */
public class LegalReferenceException extends DecisionLedgerException {

    private final List<String> rejectedReferences;

    public LegalReferenceException(String functionId, String version, List<String> rejectedReferences) {
        super(ErrorCode.LEGAL_REFERENCE, "invalid legal references for " + functionId + "@" + version + ": "
            + String.join(", ", rejectedReferences));
        this.rejectedReferences = List.copyOf(rejectedReferences);
    }

    public List<String> getRejectedReferences() {
        return rejectedReferences;
    }
}
