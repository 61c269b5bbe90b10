package com.vettriage.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON representation of a rule as it appears in a catalog document.
 * Only used for loading; {@link RuleRepository#load} turns it into a {@link Rule}.
 */
public record RuleDefinition(
    @JsonProperty("id") Integer id,
    @JsonProperty("rule_code") String ruleCode,
    @JsonProperty("name") String name,
    @JsonProperty("required_conditions") Map<String, String> requiredConditions,
    @JsonProperty("triage_level") String triageLevel,
    @JsonProperty("advice") String advice,
    @JsonProperty("priority") Integer priority
) {

    public Integer priority() {
        return priority != null ? priority : 0;
    }

    public String ruleCode() {
        if (ruleCode != null && !ruleCode.isBlank()) {
            return ruleCode;
        }
        return id != null ? "R-" + id : null;
    }
}
