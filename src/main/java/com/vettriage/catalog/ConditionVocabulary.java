package com.vettriage.catalog;

import com.vettriage.condition.Condition;
import com.vettriage.rules.InvalidRuleException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The set of condition keys the engine understands, each with its value domain.
 *
 * Extractor output is loosely typed, so it is normalized here before it can reach
 * a condition set: keys and values are canonicalized, numbers are mapped to range
 * buckets, and anything unrecognized is quarantined instead of admitted.
 */
public final class ConditionVocabulary {

    private static final Set<String> YES = Set.of("yes", "y", "true", "present", "positive");
    private static final Set<String> NO = Set.of("no", "n", "false", "absent", "negative", "none");
    private static final Set<String> UNKNOWN = Set.of("unknown", "unsure", "not sure", "don't know", "dont know", "?");

    private final Map<String, ConditionDefinition> definitions;
    private final Map<String, Set<String>> domains;

    private ConditionVocabulary(Map<String, ConditionDefinition> definitions, Map<String, Set<String>> domains) {
        this.definitions = definitions;
        this.domains = domains;
    }

    /**
     * @throws InvalidRuleException on a blank or duplicate key, or a bucket value outside the key's domain
     */
    public static ConditionVocabulary of(Collection<ConditionDefinition> entries) {
        Map<String, ConditionDefinition> defs = new LinkedHashMap<>();
        Map<String, Set<String>> domains = new LinkedHashMap<>();
        for (ConditionDefinition entry : entries) {
            if (entry == null || entry.key() == null || entry.key().isBlank()) {
                throw new InvalidRuleException("vocabulary entry without a key");
            }
            String key = canonicalKey(entry.key());
            if (defs.containsKey(key)) {
                throw new InvalidRuleException("duplicate vocabulary key: " + key);
            }

            Set<String> domain = new LinkedHashSet<>();
            for (String value : entry.values()) {
                domain.add(canonicalValue(value));
            }
            if (domain.contains(Condition.UNKNOWN)) {
                throw new InvalidRuleException("vocabulary key " + key + " lists 'unknown' as a value");
            }
            for (ConditionDefinition.Bucket bucket : entry.buckets()) {
                if (bucket.value() == null || !domain.contains(canonicalValue(bucket.value()))) {
                    throw new InvalidRuleException("bucket value " + bucket.value() + " is not in the domain of " + key);
                }
            }

            defs.put(key, entry);
            domains.put(key, Collections.unmodifiableSet(domain));
        }
        return new ConditionVocabulary(Collections.unmodifiableMap(defs), Collections.unmodifiableMap(domains));
    }

    public boolean isKnownKey(String key) {
        return key != null && domains.containsKey(key);
    }

    public Set<String> keys() {
        return domains.keySet();
    }

    /** Allowed values for the key, excluding the implicit "unknown". */
    public Set<String> domain(String key) {
        return domains.getOrDefault(key, Set.of());
    }

    public boolean isYesNo(String key) {
        Set<String> domain = domain(key);
        return domain.size() == 2 && domain.contains("yes") && domain.contains("no");
    }

    public Optional<ConditionDefinition> definition(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    public String displayName(String key) {
        ConditionDefinition def = definitions.get(key);
        return def != null ? def.displayName() : key.replace('_', ' ');
    }

    public boolean accepts(String key, String value) {
        return domain(key).contains(value);
    }

    /**
     * Normalizes raw extractor output. A nested object is read the way symptom
     * records were stored: its {@code present} entry is the value of the key itself,
     * and every other entry becomes {@code <key>_<slot>}.
     */
    public NormalizedConditions normalizeAll(Map<String, ?> raw) {
        List<Condition> accepted = new ArrayList<>();
        List<String> ignored = new ArrayList<>();
        if (raw == null) {
            return new NormalizedConditions(accepted, ignored);
        }

        raw.forEach((rawKey, rawValue) -> {
            if (rawValue instanceof Map<?, ?> nested) {
                nested.forEach((slot, slotValue) -> {
                    String slotName = String.valueOf(slot);
                    String key = "present".equals(slotName) ? rawKey : rawKey + "_" + slotName;
                    normalizeOne(key, slotValue, accepted, ignored);
                });
            } else {
                normalizeOne(rawKey, rawValue, accepted, ignored);
            }
        });
        return new NormalizedConditions(accepted, ignored);
    }

    /**
     * @return the canonical value, or empty if the key is unrecognized or the value outside its domain
     */
    public Optional<String> normalizeValue(String key, Object raw) {
        if (!isKnownKey(key)) {
            return Optional.empty();
        }
        if (raw == null) {
            return Optional.of(Condition.UNKNOWN);
        }
        if (raw instanceof List<?> list) {
            return list.size() == 1 ? normalizeValue(key, list.get(0)) : Optional.empty();
        }
        if (raw instanceof Boolean flag) {
            String value = flag ? "yes" : "no";
            return accepts(key, value) ? Optional.of(value) : Optional.empty();
        }
        if (raw instanceof Number number) {
            return bucketFor(key, number.doubleValue());
        }

        String text = canonicalValue(raw.toString());
        if (UNKNOWN.contains(text) || text.isEmpty()) {
            return Optional.of(Condition.UNKNOWN);
        }
        if (accepts(key, text)) {
            return Optional.of(text);
        }
        if (YES.contains(text) && accepts(key, "yes")) {
            return Optional.of("yes");
        }
        if (NO.contains(text) && accepts(key, "no")) {
            return Optional.of("no");
        }
        try {
            return bucketFor(key, Double.parseDouble(text));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static String canonicalKey(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }

    private static String canonicalValue(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    private void normalizeOne(String rawKey, Object rawValue, List<Condition> accepted, List<String> ignored) {
        String key = rawKey == null ? "" : canonicalKey(rawKey);
        if (!isKnownKey(key)) {
            ignored.add(rawKey + "=" + rawValue + " (unrecognized key)");
            return;
        }
        Optional<String> value = normalizeValue(key, rawValue);
        if (value.isEmpty()) {
            ignored.add(key + "=" + rawValue + " (value outside " + domain(key) + ")");
            return;
        }
        accepted.add(Condition.extracted(key, value.get()));
    }

    private Optional<String> bucketFor(String key, double number) {
        ConditionDefinition def = definitions.get(key);
        if (def == null) {
            return Optional.empty();
        }
        for (ConditionDefinition.Bucket bucket : def.buckets()) {
            if (bucket.max() == null || number <= bucket.max()) {
                return Optional.of(canonicalValue(bucket.value()));
            }
        }
        return Optional.empty();
    }

    /**
     * @param accepted conditions ready to merge, tagged as extracted
     * @param ignored  human-readable descriptions of quarantined entries
     */
    public record NormalizedConditions(List<Condition> accepted, List<String> ignored) {
        public NormalizedConditions {
            accepted = List.copyOf(accepted);
            ignored = List.copyOf(ignored);
        }
    }
}
