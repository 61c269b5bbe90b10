package com.vettriage.condition;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to a set of conditions. The matcher and selector only ever see this view.
 */
public interface ConditionView {

    Optional<Condition> get(String key);

    /** The value for the key, unless it is absent or "unknown". */
    Optional<String> knownValue(String key);

    default boolean isKnown(String key) {
        return knownValue(key).isPresent();
    }

    /** Keys present with the value "unknown". */
    Set<String> unknownKeys();

    Set<String> keys();

    Map<String, Condition> asMap();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
