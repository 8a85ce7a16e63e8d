package com.decisionledger.logic;

import com.decisionledger.common.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single {@code field operator value} test. A field that is absent from both
 * the input and the features never satisfies a condition.
 */
public record Condition(
    @JsonProperty("field") String field,
    @JsonProperty("operator") Operator operator,
    @JsonProperty("value") Object value
) {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    public Condition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("condition field is required");
        }
        if (operator == null) {
            throw new IllegalArgumentException("condition operator is required for field " + field);
        }
        if ((operator == Operator.IN || operator == Operator.NOT_IN) && !(value instanceof List<?>)) {
            throw new IllegalArgumentException("operator " + operator.getSymbol() + " on " + field + " requires a list value");
        }
        if (operator == Operator.REGEX) {
            if (!(value instanceof String regex)) {
                throw new IllegalArgumentException("regex condition on " + field + " requires a string pattern");
            }
            try {
                PATTERNS.computeIfAbsent(regex, Pattern::compile);
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("invalid regex on " + field + ": " + ex.getDescription(), ex);
            }
        }
        if (value instanceof List<?> list) {
            value = List.copyOf(list);
        }
    }

    public static Condition of(String field, Operator operator, Object value) {
        return new Condition(field, operator, value);
    }

    public boolean test(Object actual) {
        if (actual == null) {
            return false;
        }
        return switch (operator) {
            case EQ -> Values.looselyEqual(actual, value);
            case NE -> !Values.looselyEqual(actual, value);
            case LT, LE, GT, GE -> testRange(actual);
            case IN -> ((List<?>) value).stream().anyMatch(v -> Values.looselyEqual(actual, v));
            case NOT_IN -> ((List<?>) value).stream().noneMatch(v -> Values.looselyEqual(actual, v));
            case CONTAINS -> contains(actual);
            case REGEX -> actual instanceof String text
                && PATTERNS.computeIfAbsent((String) value, Pattern::compile).matcher(text).find();
        };
    }

    private boolean testRange(Object actual) {
        Integer c = compare(actual);
        if (c == null) {
            return false;
        }
        return switch (operator) {
            case LT -> c < 0;
            case LE -> c <= 0;
            case GT -> c > 0;
            default -> c >= 0;
        };
    }

    /** Null when the operands are not comparable. */
    private Integer compare(Object actual) {
        if (actual instanceof Number a && value instanceof Number b) {
            return Values.compareNumbers(a, b);
        }
        if (actual instanceof String a && value instanceof String b) {
            return a.compareTo(b);
        }
        return null;
    }

    private boolean contains(Object actual) {
        if (actual instanceof String text && value instanceof String part) {
            return text.contains(part);
        }
        if (actual instanceof List<?> list) {
            return list.stream().anyMatch(v -> Values.looselyEqual(v, value));
        }
        return false;
    }
}
