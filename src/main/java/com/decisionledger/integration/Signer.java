package com.decisionledger.integration;

/**
 * Signing capability backed by a key management service. Key material never
 * leaves the implementation; callers only name keys.
 */
public interface Signer {

    byte[] sign(byte[] payload, String keyId);

    /**
     * @throws ExternalDependencyException when the key service cannot be reached;
     *         a signature that simply does not verify returns false
     */
    boolean verify(byte[] payload, byte[] signature, String keyId);
}
