package com.decisionledger.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative rule set. Rules are tried in descending priority, ties in
 * declaration order; the first full match wins, otherwise the default result
 * applies.
 */
public final class RuleSetLogic implements Evaluatable {

    private final List<Rule> rules;
    private final List<Rule> evaluationOrder;
    private final Map<String, Object> defaultResult;

    public RuleSetLogic(List<Rule> rules, Map<String, Object> defaultResult) {
        if (rules == null) {
            throw new IllegalArgumentException("rules are required");
        }
        if (defaultResult == null) {
            throw new IllegalArgumentException("default_result is required");
        }
        this.rules = List.copyOf(rules);
        List<Rule> ordered = new ArrayList<>(this.rules);
        // List.sort is stable, so equal priorities keep declaration order.
        ordered.sort(Comparator.comparingInt(Rule::priority).reversed());
        this.evaluationOrder = List.copyOf(ordered);
        this.defaultResult = Collections.unmodifiableMap(new LinkedHashMap<>(defaultResult));
    }

    public List<Rule> rules() {
        return rules;
    }

    public Map<String, Object> defaultResult() {
        return defaultResult;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, EvaluationContext context) {
        for (Rule rule : evaluationOrder) {
            if (rule.matches(field -> input.containsKey(field) ? input.get(field) : context.features().get(field))) {
                return new LinkedHashMap<>(rule.result());
            }
        }
        return new LinkedHashMap<>(defaultResult);
    }

    @Override
    public Map<String, Object> descriptor() {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("kind", "rules");
        descriptor.put("rules", rules);
        descriptor.put("default_result", defaultResult);
        return descriptor;
    }
}
