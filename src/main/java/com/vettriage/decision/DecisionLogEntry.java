package com.vettriage.decision;

import java.time.Instant;
import java.util.Objects;

public record DecisionLogEntry(
    DecisionStage stage,
    String message,
    Instant timestamp
) {

    public DecisionLogEntry {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /** Display form, e.g. {@code [MatchFound] rule GI-002 fully satisfied}. */
    public String render() {
        return "[" + stage.label() + "] " + message;
    }
}
