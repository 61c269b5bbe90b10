package com.vettriage.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vettriage.catalog.RuleCatalogLoader;
import com.vettriage.condition.ConditionSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeywordConditionExtractorTest {

    private static KeywordConditionExtractor extractor;

    @BeforeAll
    static void loadVocabulary() {
        extractor = new KeywordConditionExtractor(new RuleCatalogLoader(new ObjectMapper())
            .load(new ClassPathResource("catalog/vet-triage-catalog.json"))
            .vocabulary());
    }

    @Nested
    @DisplayName("Free text")
    class FreeText {

        @Test
        void findsSpeciesAndSymptoms() {
            Map<String, Object> result = extract("My dog has been vomiting and seems lethargic.", null);

            assertEquals("dog", result.get("species"));
            assertEquals(Boolean.TRUE, result.get("vomiting"));
            assertEquals(Boolean.TRUE, result.get("lethargy"));
            assertEquals(3, result.size());
        }

        @Test
        void negationAppliesWithinItsClause() {
            Map<String, Object> result = extract("My cat is not vomiting, but she keeps straining to pee", null);

            assertEquals("cat", result.get("species"));
            assertEquals(Boolean.FALSE, result.get("vomiting"));
            assertEquals(Boolean.TRUE, result.get("straining_to_urinate"));
        }

        @Test
        void negationDoesNotCrossConjunctions() {
            Map<String, Object> result = extract("no diarrhea and he is coughing", null);

            assertEquals(Boolean.FALSE, result.get("diarrhea"));
            assertEquals(Boolean.TRUE, result.get("coughing"));
        }

        @Test
        void negationCarriesAcrossAnOrList() {
            Map<String, Object> result = extract("My dog has no vomiting or diarrhea", null);

            assertEquals(Boolean.FALSE, result.get("vomiting"));
            assertEquals(Boolean.FALSE, result.get("diarrhea"));
        }

        @Test
        void unrecognizedTextFails() {
            ExtractionFailureException ex = assertThrows(ExtractionFailureException.class,
                () -> extract("the weather is lovely today", null));
            assertTrue(ex.getMessage().contains("weather"));
        }

        @Test
        void punctuationOnlyFails() {
            assertThrows(ExtractionFailureException.class, () -> extract("?!", null));
        }
    }

    @Nested
    @DisplayName("Answers to a pending question")
    class Pending {

        @Test
        void shortYesAndNoBindToPendingKey() {
            assertEquals(Map.of("lethargy", Boolean.TRUE), extract("Yes.", "lethargy"));
            assertEquals(Map.of("toxin_exposure", Boolean.FALSE), extract("nope", "toxin_exposure"));
        }

        @Test
        void negatedRepliesAnswerNo() {
            assertEquals(Map.of("lethargy", Boolean.FALSE), extract("Not really", "lethargy"));
            assertEquals(Map.of("toxin_exposure", Boolean.FALSE), extract("He hasn't", "toxin_exposure"));
        }

        @Test
        void negatedReplyKeepsOtherSymptomsInLaterClauses() {
            Map<String, Object> result = extract("not really, but he is coughing", "lethargy");

            assertEquals(Boolean.FALSE, result.get("lethargy"));
            assertEquals(Boolean.TRUE, result.get("coughing"));
        }

        @Test
        void unsureAnswerIsUnknown() {
            Map<String, Object> result = extract("I'm not sure", "pale_gums");

            assertTrue(result.containsKey("pale_gums"));
            assertNull(result.get("pale_gums"));
        }

        @Test
        void numberAnswersNumericKey() {
            assertEquals(Map.of("duration_hours", 36.0), extract("about 36 hours", "duration_hours"));
        }

        @Test
        void domainWordAnswersCategoricalKey() {
            assertEquals(Map.of("species", "rabbit"), extract("she's a rabbit", "species"));
        }

        @Test
        void extraSymptomsAlongsideTheAnswerAreKept() {
            Map<String, Object> result = extract("yes, and she has diarrhea too", "vomiting");

            assertEquals(Boolean.TRUE, result.get("vomiting"));
            assertEquals(Boolean.TRUE, result.get("diarrhea"));
        }
    }

    @Test
    void normalizeKeepsDecimalsAndMarksClauses() {
        assertEquals("about 2.5 days | then not", KeywordConditionExtractor.normalize("About 2.5 days; then not!"));
    }

    private static Map<String, Object> extract(String text, String pendingKey) {
        return extractor.extract(new ExtractionContext(text, new ConditionSet(), pendingKey));
    }
}
