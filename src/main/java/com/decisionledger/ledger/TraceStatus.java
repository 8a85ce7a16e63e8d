package com.decisionledger.ledger;

public enum TraceStatus {
    OK,
    ERROR
}
