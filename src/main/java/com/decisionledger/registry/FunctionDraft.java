package com.decisionledger.registry;

import com.decisionledger.contract.DataSchema;
import com.decisionledger.logic.Evaluatable;

/**
 * Everything an author submits to register a new version.
 */
public record FunctionDraft(
    String functionId,
    String version,
    Evaluatable logic,
    DataSchema inputSchema,
    DataSchema outputSchema,
    FeatureBinding featureBinding,
    FunctionMetadata metadata
) {

    public FunctionDraft {
        if (featureBinding == null) {
            featureBinding = FeatureBinding.none();
        }
    }
}
