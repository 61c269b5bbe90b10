package com.vettriage.decision;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionStage {
    CANDIDATE_SCAN("CandidateScan"),
    CONTRADICTION_CHECK("ContradictionCheck"),
    MATCH_FOUND("MatchFound"),
    FOLLOW_UP_CHOSEN("FollowUpChosen");

    private final String label;

    DecisionStage(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
