package com.decisionledger.engine;

import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed storage for the canonical inputs, outputs and feature
 * snapshots behind trace hashes. Keys are SHA-256 of the canonical JSON.
 */
public interface PayloadArchive {

    /** Stores the canonical form of {@code payload} and returns its hash. */
    String put(Map<String, Object> payload);

    Optional<String> getCanonical(String hash);

    Optional<Map<String, Object>> get(String hash);
}
