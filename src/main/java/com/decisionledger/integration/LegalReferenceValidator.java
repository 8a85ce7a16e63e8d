package com.decisionledger.integration;

/**
 * Resolves legal reference IRIs cited by decision function metadata.
 */
public interface LegalReferenceValidator {

    LegalReferenceCheck validate(String iri);
}
