package com.decisionledger.engine;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.Hashing;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPayloadArchive implements PayloadArchive {

    private final Map<String, String> payloads = new ConcurrentHashMap<>();

    @Override
    public String put(Map<String, Object> payload) {
        String canonical = CanonicalJson.write(payload);
        String hash = Hashing.sha256Hex(canonical);
        payloads.putIfAbsent(hash, canonical);
        return hash;
    }

    @Override
    public Optional<String> getCanonical(String hash) {
        return Optional.ofNullable(payloads.get(hash));
    }

    @Override
    public Optional<Map<String, Object>> get(String hash) {
        return getCanonical(hash).map(CanonicalJson::readMap);
    }
}
