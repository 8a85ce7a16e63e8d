package com.decisionledger.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A release signature. The bytes are a signature over
 * {@link DecisionFunctionArtifact#signingPayload(SignerRole)} under the signer's key.
 */
public record Signature(
    @JsonProperty("signer_id") String signerId,
    @JsonProperty("role") SignerRole role,
    @JsonProperty("signature_bytes") byte[] signatureBytes,
    @JsonProperty("timestamp") Instant timestamp
) {

    public Signature {
        if (signerId == null || signerId.isBlank()) {
            throw new IllegalArgumentException("signer_id is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (signatureBytes == null || signatureBytes.length == 0) {
            throw new IllegalArgumentException("signature bytes are required");
        }
        signatureBytes = signatureBytes.clone();
    }

    @Override
    public byte[] signatureBytes() {
        return signatureBytes.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Signature that)) {
            return false;
        }
        return signerId.equals(that.signerId)
            && role == that.role
            && Arrays.equals(signatureBytes, that.signatureBytes)
            && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signerId, role, Arrays.hashCode(signatureBytes), timestamp);
    }

    @Override
    public String toString() {
        return "Signature[signer_id=" + signerId + ", role=" + role
            + ", signature=" + HexFormat.of().formatHex(signatureBytes) + ", timestamp=" + timestamp + "]";
    }
}
