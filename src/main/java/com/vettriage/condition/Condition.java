package com.vettriage.condition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single structured symptom fact, e.g. {@code vomiting=yes}.
 */
public record Condition(
    @JsonIgnore String key,
    @JsonProperty("value") String value,
    @JsonProperty("source") ConditionSource source
) {

    public static final String UNKNOWN = "unknown";

    public Condition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(source, "source");
        value = value == null || value.isBlank() ? UNKNOWN : value;
    }

    public static Condition extracted(String key, String value) {
        return new Condition(key, value, ConditionSource.EXTRACTED);
    }

    @JsonIgnore
    public boolean isKnown() {
        return !UNKNOWN.equals(value);
    }

    public Condition withSource(ConditionSource newSource) {
        return newSource == source ? this : new Condition(key, value, newSource);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
