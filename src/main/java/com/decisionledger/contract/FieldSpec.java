package com.decisionledger.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declared shape of a single schema field. Bounds apply to numeric fields,
 * the pattern to string fields, the enumeration to any type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldSpec(
    @JsonProperty("type") FieldType type,
    @JsonProperty("required") boolean required,
    @JsonProperty("enum_values") List<Object> enumValues,
    @JsonProperty("minimum") Double minimum,
    @JsonProperty("maximum") Double maximum,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("description") String description
) {

    public FieldSpec {
        if (type == null) {
            throw new IllegalArgumentException("field type is required");
        }
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
    }

    public static FieldSpec required(FieldType type) {
        return new FieldSpec(type, true, null, null, null, null, null);
    }

    public static FieldSpec optional(FieldType type) {
        return new FieldSpec(type, false, null, null, null, null, null);
    }

    public FieldSpec min(double value) {
        return new FieldSpec(type, required, enumValues, value, maximum, pattern, description);
    }

    public FieldSpec max(double value) {
        return new FieldSpec(type, required, enumValues, minimum, value, pattern, description);
    }

    public FieldSpec oneOf(Object... values) {
        return new FieldSpec(type, required, List.of(values), minimum, maximum, pattern, description);
    }

    public FieldSpec matching(String regex) {
        return new FieldSpec(type, required, enumValues, minimum, maximum, regex, description);
    }

    public FieldSpec describedAs(String text) {
        return new FieldSpec(type, required, enumValues, minimum, maximum, pattern, text);
    }
}
