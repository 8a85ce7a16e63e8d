package com.decisionledger.integration;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

/**
 * A remote collaborator (feature store, signer, legal reference service) could
 * not answer. Only idempotent reads are retried on this failure.
 */
public class ExternalDependencyException extends DecisionLedgerException {

    private final String dependency;

    public ExternalDependencyException(String dependency, String message) {
        super(ErrorCode.EXTERNAL_DEPENDENCY, dependency + ": " + message);
        this.dependency = dependency;
    }

    public ExternalDependencyException(String dependency, String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_DEPENDENCY, dependency + ": " + message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
