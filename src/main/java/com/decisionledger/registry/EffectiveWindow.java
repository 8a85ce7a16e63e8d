package com.decisionledger.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Half-open interval {@code [effectiveFrom, effectiveUntil)} during which one
 * version is the effective one. A null {@code effectiveUntil} is open-ended.
 */
public record EffectiveWindow(
    @JsonProperty("version") String version,
    @JsonProperty("effective_from") Instant effectiveFrom,
    @JsonProperty("effective_until") Instant effectiveUntil
) {

    public EffectiveWindow {
        if (version == null || effectiveFrom == null) {
            throw new IllegalArgumentException("version and effective_from are required");
        }
        if (effectiveUntil != null && effectiveUntil.isBefore(effectiveFrom)) {
            throw new IllegalArgumentException("effective_until precedes effective_from for " + version);
        }
    }

    public boolean isOpen() {
        return effectiveUntil == null;
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(effectiveFrom) && (effectiveUntil == null || instant.isBefore(effectiveUntil));
    }

    EffectiveWindow closedAt(Instant until) {
        return new EffectiveWindow(version, effectiveFrom, until);
    }
}
