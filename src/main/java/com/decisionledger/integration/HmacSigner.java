package com.decisionledger.integration;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Local stand-in for a KMS: HmacSHA256 with a per-key secret derived from a
 * master secret.
 */
public class HmacSigner implements Signer {

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] masterSecret;

    public HmacSigner(String masterSecret) {
        if (masterSecret == null || masterSecret.isBlank()) {
            throw new IllegalArgumentException("master secret is required");
        }
        this.masterSecret = masterSecret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] sign(byte[] payload, String keyId) {
        return mac(deriveKey(keyId), payload);
    }

    @Override
    public boolean verify(byte[] payload, byte[] signature, String keyId) {
        if (signature == null) {
            return false;
        }
        return MessageDigest.isEqual(sign(payload, keyId), signature);
    }

    private byte[] deriveKey(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("key id is required");
        }
        return mac(masterSecret, keyId.getBytes(StandardCharsets.UTF_8));
    }

    private byte[] mac(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return mac.doFinal(data);
        } catch (GeneralSecurityException ex) {
            throw new ExternalDependencyException("signer", "HMAC computation failed", ex);
        }
    }
}
