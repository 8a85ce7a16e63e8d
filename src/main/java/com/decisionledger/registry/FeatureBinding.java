package com.decisionledger.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time features a function consumes, fetched for the entity named by
 * {@code entityField} of the input.
 */
public record FeatureBinding(
    @JsonProperty("entity_field") String entityField,
    @JsonProperty("feature_names") List<String> featureNames
) {

    private static final FeatureBinding NONE = new FeatureBinding(null, List.of());

    public FeatureBinding {
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        if (!featureNames.isEmpty() && (entityField == null || entityField.isBlank())) {
            throw new IllegalArgumentException("entity_field is required when features are bound");
        }
    }

    public static FeatureBinding none() {
        return NONE;
    }

    public static FeatureBinding of(String entityField, String... featureNames) {
        return new FeatureBinding(entityField, List.of(featureNames));
    }

    public boolean isEmpty() {
        return featureNames.isEmpty();
    }
}
