package com.decisionledger.contract;

public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    DATETIME,
    OBJECT,
    ARRAY
}
