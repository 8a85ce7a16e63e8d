package com.decisionledger.logic;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.ErrorCode;

import java.util.List;
import java.util.stream.Collectors;

public class RuleConflictException extends DecisionLedgerException {

    private final List<RuleConflict> conflicts;

    public RuleConflictException(String functionId, String version, List<RuleConflict> conflicts) {
        super(ErrorCode.RULE_CONFLICT, "rule set of " + functionId + "@" + version + " is ambiguous: "
            + conflicts.stream().map(RuleConflict::message).collect(Collectors.joining("; ")));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<RuleConflict> getConflicts() {
        return conflicts;
    }
}
