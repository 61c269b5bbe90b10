package com.vettriage.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Ordered triage severity. A higher {@link #severity()} is more urgent.
 */
public enum TriageLevel {
    ROUTINE("routine", 1),
    URGENT("urgent", 2),
    EMERGENCY("emergency", 3);

    /** Orders levels from least to most severe. */
    public static final Comparator<TriageLevel> BY_SEVERITY = Comparator.comparingInt(TriageLevel::severity);

    private final String value;
    private final int severity;

    TriageLevel(String value, int severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int severity() {
        return severity;
    }

    public boolean isMoreSevereThan(TriageLevel other) {
        return severity > other.severity;
    }

    public static TriageLevel lowest() {
        return ROUTINE;
    }

    @JsonCreator
    public static TriageLevel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown triage level: " + raw));
    }
}
