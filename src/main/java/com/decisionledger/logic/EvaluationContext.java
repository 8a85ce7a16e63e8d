package com.decisionledger.logic;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a decision function may see besides its input: its own identity,
 * the point in time it is evaluated for and the features as known at that time.
 * Logic must not read the wall clock; {@link #asOf()} is the only notion of now.
 */
public record EvaluationContext(
    String functionId,
    String version,
    Instant asOf,
    Map<String, Object> features
) {

    public EvaluationContext {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public Optional<Object> feature(String name) {
        return Optional.ofNullable(features.get(name));
    }
}
