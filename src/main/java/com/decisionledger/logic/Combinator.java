package com.decisionledger.logic;

/** How a rule's conditions are combined. */
public enum Combinator {
    ALL,
    ANY
}
