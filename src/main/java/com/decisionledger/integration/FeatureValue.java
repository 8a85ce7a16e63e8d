package com.decisionledger.integration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** A feature value together with the time it became known. */
public record FeatureValue(
    @JsonProperty("value") Object value,
    @JsonProperty("observed_at") Instant observedAt
) {
}
