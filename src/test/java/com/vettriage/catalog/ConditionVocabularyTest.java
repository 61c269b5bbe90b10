package com.vettriage.catalog;

import com.vettriage.condition.Condition;
import com.vettriage.rules.InvalidRuleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConditionVocabularyTest {

    private final ConditionVocabulary vocabulary = ConditionVocabulary.of(List.of(
        yesNo("vomiting"),
        yesNo("vomiting_blood"),
        new ConditionDefinition("species", null, List.of("dog", "cat"), null, null, null),
        new ConditionDefinition("duration_hours", null, List.of("under_24h", "24_to_72h", "over_72h"), null, null,
            List.of(new ConditionDefinition.Bucket("under_24h", 24.0),
                new ConditionDefinition.Bucket("24_to_72h", 72.0),
                new ConditionDefinition.Bucket("over_72h", null)))
    ));

    @Nested
    @DisplayName("Value normalization")
    class Values {

        @Test
        void mapsBooleansAndSynonymsToYesNo() {
            assertEquals(Optional.of("yes"), vocabulary.normalizeValue("vomiting", true));
            assertEquals(Optional.of("no"), vocabulary.normalizeValue("vomiting", "Absent"));
            assertEquals(Optional.of("yes"), vocabulary.normalizeValue("vomiting", " YES "));
        }

        @Test
        void mapsMissingAndUnsureToUnknown() {
            assertEquals(Optional.of(Condition.UNKNOWN), vocabulary.normalizeValue("vomiting", null));
            assertEquals(Optional.of(Condition.UNKNOWN), vocabulary.normalizeValue("species", "not sure"));
        }

        @Test
        void bucketsNumbers() {
            assertEquals(Optional.of("under_24h"), vocabulary.normalizeValue("duration_hours", 6));
            assertEquals(Optional.of("24_to_72h"), vocabulary.normalizeValue("duration_hours", 48.5));
            assertEquals(Optional.of("over_72h"), vocabulary.normalizeValue("duration_hours", "96"));
        }

        @Test
        void unwrapsSingleElementLists() {
            assertEquals(Optional.of("dog"), vocabulary.normalizeValue("species", List.of("Dog")));
            assertEquals(Optional.empty(), vocabulary.normalizeValue("species", List.of("dog", "cat")));
        }

        @Test
        void rejectsValuesOutsideDomain() {
            assertEquals(Optional.empty(), vocabulary.normalizeValue("species", "parrot"));
            assertEquals(Optional.empty(), vocabulary.normalizeValue("species", true));
        }
    }

    @Nested
    @DisplayName("Quarantine")
    class Quarantine {

        @Test
        void unrecognizedKeysAndValuesAreIgnored() {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("Vomiting", "yes");
            raw.put("sneezing", "yes");
            raw.put("species", "parrot");

            ConditionVocabulary.NormalizedConditions result = vocabulary.normalizeAll(raw);

            assertEquals(List.of(Condition.extracted("vomiting", "yes")), result.accepted());
            assertEquals(2, result.ignored().size());
            assertTrue(result.ignored().get(0).startsWith("sneezing"));
            assertTrue(result.ignored().get(1).startsWith("species=parrot"));
        }

        @Test
        void nestedRecordsBecomeSlotKeys() {
            Map<String, Object> nested = new LinkedHashMap<>();
            nested.put("present", true);
            nested.put("blood", "no");
            ConditionVocabulary.NormalizedConditions result = vocabulary.normalizeAll(Map.of("vomiting", nested));

            assertEquals(List.of(Condition.extracted("vomiting", "yes"), Condition.extracted("vomiting_blood", "no")),
                result.accepted());
            assertTrue(result.ignored().isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void rejectsDuplicateKeys() {
            assertThrows(InvalidRuleException.class,
                () -> ConditionVocabulary.of(List.of(yesNo("cough"), yesNo("Cough"))));
        }

        @Test
        void rejectsUnknownAsDeclaredValue() {
            assertThrows(InvalidRuleException.class, () -> ConditionVocabulary.of(List.of(
                new ConditionDefinition("species", null, List.of("dog", "unknown"), null, null, null))));
        }

        @Test
        void rejectsBucketOutsideDomain() {
            assertThrows(InvalidRuleException.class, () -> ConditionVocabulary.of(List.of(
                new ConditionDefinition("age", null, List.of("young", "old"), null, null,
                    List.of(new ConditionDefinition.Bucket("ancient", null))))));
        }
    }

    @Test
    void yesNoIsTheDefaultDomain() {
        assertTrue(vocabulary.isYesNo("vomiting"));
        assertFalse(vocabulary.isYesNo("species"));
        assertEquals("duration hours", vocabulary.displayName("duration_hours"));
    }

    private static ConditionDefinition yesNo(String key) {
        return new ConditionDefinition(key, null, null, null, null, null);
    }
}
