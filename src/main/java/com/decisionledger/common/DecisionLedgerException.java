package com.decisionledger.common;

/**
 * Root of every failure the decision layer surfaces to its callers.
 */
public abstract class DecisionLedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected DecisionLedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DecisionLedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
