package com.decisionledger.registry;

public enum SignerRole {
    OWNER,
    REVIEWER;

    public SignerRole other() {
        return this == OWNER ? REVIEWER : OWNER;
    }
}
