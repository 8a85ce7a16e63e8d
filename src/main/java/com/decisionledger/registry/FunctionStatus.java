package com.decisionledger.registry;

public enum FunctionStatus {
    DRAFT,
    PENDING_REVIEW,
    APPROVED,
    ACTIVE,
    DEPRECATED,
    RETIRED;

    /** Logic, schemas and hashes of a version are frozen once it leaves DRAFT. */
    public boolean isFrozen() {
        return this != DRAFT;
    }

    /** Fully signed at some point; such a version can never return to DRAFT. */
    public boolean isReleased() {
        return this == APPROVED || this == ACTIVE || this == DEPRECATED || this == RETIRED;
    }
}
