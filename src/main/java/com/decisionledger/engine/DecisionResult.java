package com.decisionledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DecisionResult(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("function_id") String functionId,
    @JsonProperty("version") String version,
    @JsonProperty("function_hash") String functionHash,
    @JsonProperty("output") Map<String, Object> output,
    @JsonProperty("input_hash") String inputHash,
    @JsonProperty("output_hash") String outputHash,
    @JsonProperty("feature_snapshot_ref") String featureSnapshotRef,
    @JsonProperty("sequence") long sequence,
    @JsonProperty("chain_hash") String chainHash,
    @JsonProperty("as_of") Instant asOf
) {

    public DecisionResult {
        output = Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }
}
