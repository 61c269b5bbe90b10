package com.vettriage.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of one vocabulary entry: a condition key, its value domain,
 * the phrases that mention it and the question used to ask about it.
 */
public record ConditionDefinition(
    @JsonProperty("key") String key,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("values") List<String> values,
    @JsonProperty("aliases") List<String> aliases,
    @JsonProperty("question") String question,
    @JsonProperty("buckets") List<Bucket> buckets
) {

    /**
     * Numeric range mapped to a domain value. A null {@code max} is open-ended.
     */
    public record Bucket(
        @JsonProperty("value") String value,
        @JsonProperty("max") Double max
    ) {}

    public List<String> values() {
        return values != null && !values.isEmpty() ? values : List.of("yes", "no");
    }

    public List<String> aliases() {
        return aliases != null ? aliases : List.of();
    }

    public List<Bucket> buckets() {
        return buckets != null ? buckets : List.of();
    }

    public String displayName() {
        return displayName != null && !displayName.isBlank() ? displayName : key.replace('_', ' ');
    }
}
