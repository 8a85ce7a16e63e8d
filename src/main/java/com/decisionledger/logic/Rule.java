package com.decisionledger.logic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * One declarative rule: when its conditions hold, its result is the decision.
 * {@link Combinator#ALL} over no conditions always matches, {@link Combinator#ANY}
 * over no conditions never does.
 */
public record Rule(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("priority") int priority,
    @JsonProperty("combinator") Combinator combinator,
    @JsonProperty("conditions") List<Condition> conditions,
    @JsonProperty("result") Map<String, Object> result,
    @JsonProperty("description") String description
) {

    public Rule {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("rule_id is required");
        }
        if (result == null) {
            throw new IllegalArgumentException("rule " + ruleId + " has no result");
        }
        combinator = combinator == null ? Combinator.ALL : combinator;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        result = Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static Rule all(String ruleId, int priority, List<Condition> conditions, Map<String, Object> result) {
        return new Rule(ruleId, priority, Combinator.ALL, conditions, result, null);
    }

    public static Rule any(String ruleId, int priority, List<Condition> conditions, Map<String, Object> result) {
        return new Rule(ruleId, priority, Combinator.ANY, conditions, result, null);
    }

    public boolean matches(Function<String, Object> fieldLookup) {
        if (combinator == Combinator.ALL) {
            return conditions.stream().allMatch(c -> c.test(fieldLookup.apply(c.field())));
        }
        return conditions.stream().anyMatch(c -> c.test(fieldLookup.apply(c.field())));
    }
}
