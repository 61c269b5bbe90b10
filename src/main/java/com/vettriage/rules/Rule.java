package com.vettriage.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable diagnostic pattern. Every required condition must hold for a full match.
 *
 * @param id                 unique numeric id, also the last tie-breaker (lower wins)
 * @param code               stable catalog code, e.g. "GI-003"
 * @param name               human-readable name
 * @param requiredConditions condition key to required value, in catalog order
 * @param triageLevel        severity reported on a match
 * @param advice             advice text attached to the rule
 * @param priority           tie-break weight, independent of severity (higher wins)
 */
public record Rule(
    int id,
    String code,
    String name,
    Map<String, String> requiredConditions,
    TriageLevel triageLevel,
    String advice,
    int priority
) {

    public Rule {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(triageLevel, "triageLevel");
        name = name != null ? name : code;
        advice = advice != null ? advice : "";
        requiredConditions = requiredConditions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(requiredConditions));
    }

    public Set<String> requiredKeys() {
        return requiredConditions.keySet();
    }

    public String requiredValue(String key) {
        return requiredConditions.get(key);
    }
}
