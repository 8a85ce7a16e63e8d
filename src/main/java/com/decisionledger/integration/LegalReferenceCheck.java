package com.decisionledger.integration;

public record LegalReferenceCheck(boolean valid, String title, String section) {

    public static LegalReferenceCheck invalid() {
        return new LegalReferenceCheck(false, null, null);
    }
}
