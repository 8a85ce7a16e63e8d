package com.decisionledger.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of replaying one recorded decision. Audit output only; never
 * written to the ledger.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DriftReport(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("function_id") String functionId,
    @JsonProperty("original_version") String originalVersion,
    @JsonProperty("replayed_version") String replayedVersion,
    @JsonProperty("original_output_hash") String originalOutputHash,
    @JsonProperty("replayed_output_hash") String replayedOutputHash,
    @JsonProperty("match") boolean match,
    @JsonProperty("classification") DriftClassification classification,
    @JsonProperty("changed_fields") List<String> changedFields,
    @JsonProperty("replay_error") String replayError
) {

    public DriftReport {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }
}
