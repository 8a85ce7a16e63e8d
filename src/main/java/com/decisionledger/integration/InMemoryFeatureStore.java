package com.decisionledger.integration;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Keeps every observation so that any past instant can be reconstructed.
 */
public class InMemoryFeatureStore implements FeatureStore {

    private final Map<String, Map<String, NavigableMap<Instant, Object>>> observations = new ConcurrentHashMap<>();

    public void record(String entityId, String name, Object value, Instant observedAt) {
        if (value == null) {
            throw new IllegalArgumentException("feature value cannot be null");
        }
        observations
            .computeIfAbsent(entityId, e -> new ConcurrentHashMap<>())
            .computeIfAbsent(name, n -> new ConcurrentSkipListMap<>())
            .put(observedAt, value);
    }

    @Override
    public Map<String, FeatureValue> getFeaturesAt(String entityId, Collection<String> names, Instant asOf) {
        Map<String, FeatureValue> result = new LinkedHashMap<>();
        Map<String, NavigableMap<Instant, Object>> byName = observations.getOrDefault(entityId, Map.of());
        for (String name : names) {
            NavigableMap<Instant, Object> history = byName.get(name);
            if (history == null) {
                continue;
            }
            Map.Entry<Instant, Object> entry = history.floorEntry(asOf);
            if (entry != null) {
                result.put(name, new FeatureValue(entry.getValue(), entry.getKey()));
            }
        }
        return result;
    }
}
