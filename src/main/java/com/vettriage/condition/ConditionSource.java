package com.vettriage.condition;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionSource {
    /** Extracted from the user's text during the current turn. */
    EXTRACTED("extracted"),
    /** Carried over from an earlier turn of the same conversation. */
    CONFIRMED("confirmed");

    private final String value;

    ConditionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
