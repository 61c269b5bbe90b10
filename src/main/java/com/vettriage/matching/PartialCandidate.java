package com.vettriage.matching;

import com.vettriage.rules.Rule;

import java.util.List;
import java.util.Objects;

/**
 * A rule that survived the contradiction filter but is not yet fully satisfied.
 *
 * @param rule        the candidate rule
 * @param missingKeys required keys absent or "unknown" in the current conditions, in rule order
 */
public record PartialCandidate(Rule rule, List<String> missingKeys) {

    public PartialCandidate {
        Objects.requireNonNull(rule, "rule");
        missingKeys = List.copyOf(missingKeys);
    }

    public int missingCount() {
        return missingKeys.size();
    }

    public int satisfiedCount() {
        return rule.requiredConditions().size() - missingKeys.size();
    }
}
