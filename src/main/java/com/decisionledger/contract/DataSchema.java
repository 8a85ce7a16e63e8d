package com.decisionledger.contract;

import com.decisionledger.common.CanonicalJson;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Input or output contract of a decision function. A closed schema rejects
 * fields it does not declare.
 */
public record DataSchema(
    @JsonProperty("fields") Map<String, FieldSpec> fields,
    @JsonProperty("closed") boolean closed
) {

    public DataSchema {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean declares(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldsOfType(FieldType type) {
        return fields.entrySet().stream()
            .filter(e -> e.getValue().type() == type)
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    public String contentHash() {
        return CanonicalJson.hash(this);
    }

    public static final class Builder {

        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private boolean closed;

        public Builder field(String name, FieldSpec spec) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name is required");
            }
            fields.put(name, spec);
            return this;
        }

        public Builder closed() {
            this.closed = true;
            return this;
        }

        public DataSchema build() {
            return new DataSchema(fields, closed);
        }
    }
}
