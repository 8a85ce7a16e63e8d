package com.decisionledger.ledger;

public enum EventType {
    DECISION_EXECUTED(false),
    FUNCTION_REGISTERED(true),
    RELEASE_REQUESTED(true),
    RELEASE_SIGNED(true),
    RELEASE_REJECTED(true),
    RELEASE_APPROVED(true),
    VERSION_ACTIVATED(true),
    VERSION_DEPRECATED(true),
    VERSION_RETIRED(true);

    private final boolean governance;

    EventType(boolean governance) {
        this.governance = governance;
    }

    public boolean isGovernance() {
        return governance;
    }
}
