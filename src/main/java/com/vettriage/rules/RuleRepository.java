package com.vettriage.rules;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only, ordered collection of rules indexed by condition key.
 *
 * Built once through {@link #load(List)} and never mutated afterwards, so a single
 * instance is shared by all sessions without locking.
 */
public final class RuleRepository {

    private final List<Rule> rules;
    private final Map<Integer, Rule> byId;
    private final Map<String, Set<Rule>> byConditionKey;

    private RuleRepository(List<Rule> rules) {
        this.rules = List.copyOf(rules);

        Map<Integer, Rule> ids = new HashMap<>();
        Map<String, Set<Rule>> index = new HashMap<>();
        for (Rule rule : this.rules) {
            ids.put(rule.id(), rule);
            for (String key : rule.requiredKeys()) {
                index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(rule);
            }
        }
        index.replaceAll((key, set) -> Collections.unmodifiableSet(set));

        this.byId = Map.copyOf(ids);
        this.byConditionKey = Map.copyOf(index);
    }

    /**
     * Validates the definitions and builds the repository, preserving their order.
     *
     * @throws InvalidRuleException if a rule has no required conditions, a missing or
     *                              duplicate id, or an unrecognized triage level
     */
    public static RuleRepository load(List<RuleDefinition> definitions) {
        if (definitions == null) {
            throw new InvalidRuleException("rule catalog is missing");
        }

        Map<Integer, Rule> loaded = new LinkedHashMap<>();
        for (RuleDefinition def : definitions) {
            if (def == null) {
                throw new InvalidRuleException("rule catalog contains a null entry");
            }
            if (def.id() == null) {
                throw new InvalidRuleException("rule " + def.ruleCode() + " has no id");
            }
            if (loaded.containsKey(def.id())) {
                throw new InvalidRuleException("duplicate rule id: " + def.id());
            }
            if (def.requiredConditions() == null || def.requiredConditions().isEmpty()) {
                throw new InvalidRuleException("rule " + def.id() + " has no required conditions");
            }

            TriageLevel level;
            try {
                level = TriageLevel.fromValue(def.triageLevel());
            } catch (IllegalArgumentException ex) {
                throw new InvalidRuleException("rule " + def.id() + ": " + ex.getMessage(), ex);
            }
            if (level == null) {
                throw new InvalidRuleException("rule " + def.id() + " has no triage_level");
            }

            Map<String, String> required = new LinkedHashMap<>();
            def.requiredConditions().forEach((key, value) -> {
                if (key == null || key.isBlank() || value == null || value.isBlank()) {
                    throw new InvalidRuleException("rule " + def.id() + " has a blank condition key or value");
                }
                required.put(normalize(key), normalize(value));
            });

            loaded.put(def.id(), new Rule(def.id(), def.ruleCode(), def.name(), required,
                level, def.advice(), def.priority()));
        }
        return new RuleRepository(List.copyOf(loaded.values()));
    }

    /** Rules referencing the given condition key, in catalog order. */
    public Set<Rule> candidatesFor(String conditionKey) {
        return byConditionKey.getOrDefault(conditionKey, Set.of());
    }

    public List<Rule> all() {
        return rules;
    }

    public Optional<Rule> findById(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Every condition key referenced by at least one rule. */
    public Set<String> referencedKeys() {
        return byConditionKey.keySet();
    }

    public int size() {
        return rules.size();
    }

    private static String normalize(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
