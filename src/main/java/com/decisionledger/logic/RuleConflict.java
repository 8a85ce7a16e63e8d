package com.decisionledger.logic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RuleConflict(
    @JsonProperty("type") ConflictType type,
    @JsonProperty("rule_ids") List<String> ruleIds,
    @JsonProperty("message") String message
) {

    public RuleConflict {
        ruleIds = List.copyOf(ruleIds);
    }

    public boolean isBlocking() {
        return type.isBlocking();
    }
}
