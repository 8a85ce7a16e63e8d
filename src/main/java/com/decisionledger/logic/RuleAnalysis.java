package com.decisionledger.logic;

import java.util.List;

/**
 * Outcome of static analysis over a rule set.
 */
public record RuleAnalysis(List<RuleConflict> findings) {

    public RuleAnalysis {
        findings = List.copyOf(findings);
    }

    public List<RuleConflict> blocking() {
        return findings.stream().filter(RuleConflict::isBlocking).toList();
    }

    public boolean hasBlockingConflicts() {
        return findings.stream().anyMatch(RuleConflict::isBlocking);
    }

    /** Findings a reviewer must look at before signing, rendered as notes. */
    public List<String> reviewNotes() {
        return findings.stream()
            .filter(f -> !f.isBlocking())
            .map(f -> f.type().name().toLowerCase() + ": " + f.message())
            .toList();
    }
}
