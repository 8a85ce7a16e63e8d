package com.decisionledger.logic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Operator {
    EQ("==", true),
    NE("!=", false),
    LT("<", true),
    LE("<=", true),
    GT(">", true),
    GE(">=", true),
    IN("in", true),
    NOT_IN("not_in", false),
    CONTAINS("contains", false),
    REGEX("regex", false);

    private final String symbol;
    private final boolean analyzable;

    Operator(String symbol, boolean analyzable) {
        this.symbol = symbol;
        this.analyzable = analyzable;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /**
     * Whether the set of values satisfying this operator can be intersected
     * with others statically (equality, ranges and enum membership).
     */
    public boolean isAnalyzable() {
        return analyzable;
    }

    public boolean isRange() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    @JsonCreator
    public static Operator fromSymbol(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.symbol.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + raw));
    }
}
