package com.decisionledger.logic;

import com.decisionledger.common.CanonicalJson;

import java.util.Map;

/**
 * Executable representation of a decision function version. The engine is
 * agnostic to whether a version is backed by code or by a rule set.
 */
public interface Evaluatable {

    /**
     * Evaluate against an already validated input.
     *
     * @return the decision output, validated by the caller against the output schema
     */
    Map<String, Object> execute(Map<String, Object> input, EvaluationContext context);

    /**
     * Canonical description of the logic. Two logics with equal descriptors are
     * treated as the same logic.
     */
    Map<String, Object> descriptor();

    default String logicHash() {
        return CanonicalJson.hash(descriptor());
    }
}
