package com.decisionledger.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FunctionMetadata(
    @JsonProperty("author") String author,
    @JsonProperty("description") String description,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("legal_references") List<String> legalReferences,
    @JsonProperty("change_summary") String changeSummary
) {

    public FunctionMetadata {
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author is required");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        legalReferences = legalReferences == null ? List.of() : List.copyOf(legalReferences);
    }

    public static FunctionMetadata of(String author, String description) {
        return new FunctionMetadata(author, description, List.of(), List.of(), null);
    }

    public FunctionMetadata withLegalReferences(String... iris) {
        return new FunctionMetadata(author, description, tags, List.of(iris), changeSummary);
    }
}
