package com.decisionledger.contract;

import com.decisionledger.common.Values;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks decision inputs and outputs against their declared {@link DataSchema}.
 * All violations are collected before failing.
 */
@Component
public class SchemaValidator {

    public enum Direction {
        INPUT,
        OUTPUT
    }

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public void validate(DataSchema schema, Map<String, Object> data, Direction direction) {
        List<FieldViolation> violations = check(schema, data);
        if (!violations.isEmpty()) {
            throw new ValidationException(direction, violations);
        }
    }

    public List<FieldViolation> check(DataSchema schema, Map<String, Object> data) {
        List<FieldViolation> violations = new ArrayList<>();
        if (data == null) {
            violations.add(new FieldViolation("$", "payload is required"));
            return violations;
        }

        for (Map.Entry<String, FieldSpec> entry : schema.fields().entrySet()) {
            String field = entry.getKey();
            FieldSpec spec = entry.getValue();
            Object value = data.get(field);
            if (value == null) {
                if (spec.required()) {
                    violations.add(new FieldViolation(field, "is required"));
                }
                continue;
            }
            checkField(field, spec, value, violations);
        }

        if (schema.closed()) {
            for (String field : data.keySet()) {
                if (!schema.declares(field)) {
                    violations.add(new FieldViolation(field, "is not declared by the schema"));
                }
            }
        }
        return violations;
    }

    private void checkField(String field, FieldSpec spec, Object value, List<FieldViolation> violations) {
        String typeError = checkType(spec.type(), value);
        if (typeError != null) {
            violations.add(new FieldViolation(field, typeError));
            return;
        }

        if (spec.enumValues() != null
            && spec.enumValues().stream().noneMatch(allowed -> Values.looselyEqual(allowed, value))) {
            violations.add(new FieldViolation(field, "must be one of " + spec.enumValues()));
        }

        if (value instanceof Number number) {
            if (spec.minimum() != null && Values.compareNumbers(number, spec.minimum()) < 0) {
                violations.add(new FieldViolation(field, "must be >= " + spec.minimum()));
            }
            if (spec.maximum() != null && Values.compareNumbers(number, spec.maximum()) > 0) {
                violations.add(new FieldViolation(field, "must be <= " + spec.maximum()));
            }
        }

        if (value instanceof String text && spec.pattern() != null) {
            Pattern pattern = compile(spec.pattern());
            if (pattern == null) {
                violations.add(new FieldViolation(field, "schema pattern is not a valid regex: " + spec.pattern()));
            } else if (!pattern.matcher(text).matches()) {
                violations.add(new FieldViolation(field, "must match pattern " + spec.pattern()));
            }
        }
    }

    private String checkType(FieldType type, Object value) {
        return switch (type) {
            case STRING -> value instanceof String ? null : mismatch("string", value);
            case INTEGER -> Values.isIntegral(value) ? null : mismatch("integer", value);
            case NUMBER -> value instanceof Number ? null : mismatch("number", value);
            case BOOLEAN -> value instanceof Boolean ? null : mismatch("boolean", value);
            case OBJECT -> value instanceof Map<?, ?> ? null : mismatch("object", value);
            case ARRAY -> value instanceof List<?> ? null : mismatch("array", value);
            case DATETIME -> isDateTime(value) ? null : "must be an ISO-8601 datetime";
        };
    }

    private boolean isDateTime(Object value) {
        if (!(value instanceof String text)) {
            return false;
        }
        try {
            Instant.parse(text);
            return true;
        } catch (DateTimeParseException ex) {
            return isOffsetDateTime(text);
        }
    }

    private boolean isOffsetDateTime(String text) {
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    private Pattern compile(String regex) {
        try {
            return patterns.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException ex) {
            return null;
        }
    }

    private static String mismatch(String expected, Object value) {
        return "expected " + expected + " but got " + value.getClass().getSimpleName();
    }
}
