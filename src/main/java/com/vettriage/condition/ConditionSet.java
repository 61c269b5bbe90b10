package com.vettriage.condition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulated conditions for one conversation. Keys are unique; a re-asserted key
 * takes the latest value, except that "unknown" never replaces a known value.
 *
 * Not thread-safe. The owning session serializes access.
 */
public class ConditionSet implements ConditionView {

    private final Map<String, Condition> conditions = new LinkedHashMap<>();

    public ConditionSet() {
    }

    private ConditionSet(Map<String, Condition> source) {
        conditions.putAll(source);
    }

    public static ConditionSet of(Condition... items) {
        ConditionSet set = new ConditionSet();
        for (Condition c : items) {
            set.assertCondition(c);
        }
        return set;
    }

    /**
     * Merges one condition.
     *
     * @return true if the set changed
     */
    public boolean assertCondition(Condition condition) {
        Condition existing = conditions.get(condition.key());
        if (existing != null) {
            if (!condition.isKnown() && existing.isKnown()) {
                return false;
            }
            if (existing.value().equals(condition.value())) {
                return false;
            }
        }
        conditions.put(condition.key(), condition);
        return true;
    }

    /** Marks every condition as carried over from an earlier turn. */
    public void confirmAll() {
        conditions.replaceAll((key, c) -> c.withSource(ConditionSource.CONFIRMED));
    }

    public void clear() {
        conditions.clear();
    }

    /** A detached, independent copy. */
    public ConditionSet copy() {
        return new ConditionSet(conditions);
    }

    @Override
    public Optional<Condition> get(String key) {
        return Optional.ofNullable(conditions.get(key));
    }

    @Override
    public Optional<String> knownValue(String key) {
        Condition c = conditions.get(key);
        return c != null && c.isKnown() ? Optional.of(c.value()) : Optional.empty();
    }

    @Override
    public Set<String> unknownKeys() {
        Set<String> keys = new LinkedHashSet<>();
        conditions.values().stream()
            .filter(c -> !c.isKnown())
            .forEach(c -> keys.add(c.key()));
        return keys;
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(conditions.keySet());
    }

    @Override
    public Map<String, Condition> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    @Override
    public int size() {
        return conditions.size();
    }

    @Override
    public String toString() {
        return conditions.values().toString();
    }
}
