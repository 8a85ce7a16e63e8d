package com.decisionledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalJsonTest {

    @Test
    @DisplayName("Key order does not change the canonical form or its hash")
    void keyOrder_isIrrelevant() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", Map.of("y", 1, "x", List.of(3, 1)));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", Map.of("x", List.of(3, 1), "y", 1));
        second.put("b", 2);

        assertEquals("{\"a\":{\"x\":[3,1],\"y\":1},\"b\":2}", CanonicalJson.write(first));
        assertEquals(CanonicalJson.hash(first), CanonicalJson.hash(second));
    }

    @Test
    void instants_areWrittenAsIsoText() {
        assertEquals("{\"at\":\"2024-01-01T00:00:00Z\"}",
            CanonicalJson.write(Map.of("at", Instant.parse("2024-01-01T00:00:00Z"))));
    }

    @Test
    void normalize_yieldsTheTypesAReaderOfTheStoredFormSees() {
        Map<String, Object> normalized = CanonicalJson.normalize(Map.of("amount", 5000L, "tags", List.of("a")));
        assertEquals(5000, normalized.get("amount"));
        assertEquals(List.of("a"), normalized.get("tags"));
        assertEquals(CanonicalJson.hash(Map.of("amount", 5000L, "tags", List.of("a"))), CanonicalJson.hash(normalized));
    }

    @Test
    void hash_isSha256OfCanonicalBytes() {
        assertEquals(Hashing.sha256Hex("{\"k\":\"v\"}"), CanonicalJson.hash(Map.of("k", "v")));
        assertEquals(64, CanonicalJson.hash(Map.of()).length());
    }
}
