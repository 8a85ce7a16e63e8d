package com.decisionledger.integration;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Point-in-time feature lookup.
 */
public interface FeatureStore {

    /**
     * Returns, for each requested name that has a value, the latest observation
     * made at or before {@code asOf}. Values observed after {@code asOf} must never
     * be returned. Names without such an observation are absent from the result.
     *
     * @throws ExternalDependencyException when the store cannot be reached
     */
    Map<String, FeatureValue> getFeaturesAt(String entityId, Collection<String> names, Instant asOf);
}
