package com.decisionledger.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Canonical JSON serialization: keys sorted, no whitespace, ISO-8601 instants.
 * Every content hash in the system is computed over this form.
 */
public final class CanonicalJson {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .build();

    private CanonicalJson() {
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    public static byte[] bytes(Object value) {
        return write(value).getBytes(StandardCharsets.UTF_8);
    }

    public static Map<String, Object> readMap(String json) {
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("not a JSON object: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Round-trips a map through canonical JSON so that numeric and collection
     * types are the ones a later reader of the stored form will see.
     */
    public static Map<String, Object> normalize(Map<String, ?> value) {
        return readMap(write(value));
    }

    /** SHA-256 of the canonical form, hex encoded. */
    public static String hash(Object value) {
        return Hashing.sha256Hex(bytes(value));
    }
}
