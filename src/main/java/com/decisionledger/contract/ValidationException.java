package com.decisionledger.contract;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a payload breaks its schema. Carries every violated field,
 * not only the first one found.
 */
public class ValidationException extends DecisionLedgerException {

    private final SchemaValidator.Direction direction;
    private final List<FieldViolation> violations;

    public ValidationException(SchemaValidator.Direction direction, List<FieldViolation> violations) {
        super(ErrorCode.VALIDATION_ERROR, direction.name().toLowerCase() + " validation failed: "
            + violations.stream().map(FieldViolation::toString).collect(Collectors.joining("; ")));
        this.direction = direction;
        this.violations = List.copyOf(violations);
    }

    public SchemaValidator.Direction getDirection() {
        return direction;
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public List<String> violatedFields() {
        return violations.stream().map(FieldViolation::field).distinct().toList();
    }
}
