package com.decisionledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Whole-ledger integrity check plus what the checked records cover.
 * {@code coverage} holds {@code function_id@version} of every decision seen.
 */
public record ChainVerificationReport(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("first_broken_trace_id") String firstBrokenTraceId,
    @JsonProperty("records_checked") long recordsChecked,
    @JsonProperty("decision_records") long decisionRecords,
    @JsonProperty("governance_records") long governanceRecords,
    @JsonProperty("coverage") Set<String> coverage
) {

    public ChainVerificationReport {
        coverage = Set.copyOf(coverage);
    }
}
