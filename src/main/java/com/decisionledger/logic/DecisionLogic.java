package com.decisionledger.logic;

import java.util.Map;

/**
 * Opaque decision code. Implementations must be pure functions of their
 * arguments.
 */
@FunctionalInterface
public interface DecisionLogic {

    Map<String, Object> apply(Map<String, Object> input, EvaluationContext context) throws Exception;
}
