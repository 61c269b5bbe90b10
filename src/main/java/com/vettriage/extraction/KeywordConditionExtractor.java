package com.vettriage.extraction;

import com.vettriage.catalog.ConditionDefinition;
import com.vettriage.catalog.ConditionVocabulary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic extractor driven by the vocabulary's alias phrases.
 *
 * Recognizes:
 * - alias phrases of yes/no keys, negated when a negator appears among the three preceding
 *   words of the same clause; a negator carries across an "or" list ("no vomiting or diarrhea")
 * - domain value words of other keys ("dog", "cat")
 * - short answers (yes / no / not sure / "not really") and numbers, bound to the pending follow-up key
 *
 * Used when no language-model extractor is configured.
 */
public class KeywordConditionExtractor implements ConditionExtractor {

    private static final Set<String> AFFIRMATIVE = Set.of(
        "yes", "yeah", "yep", "yup", "y", "correct", "definitely", "absolutely", "sure", "true");
    private static final Set<String> NEGATIVE = Set.of(
        "no", "nope", "nah", "n", "never", "false");
    private static final List<String> UNSURE = List.of(
        "not sure", "unsure", "don't know", "dont know", "no idea", "unknown", "maybe", "can't tell", "cant tell");
    private static final Set<String> NEGATORS = Set.of(
        "no", "not", "without", "isn't", "isnt", "hasn't", "hasnt", "never", "doesn't", "doesnt",
        "didn't", "didnt", "nor", "haven't", "havent", "wasn't", "wasnt", "aren't", "arent",
        "can't", "cant", "cannot", "won't", "wont");
    private static final Set<String> CLAUSE_BREAKS = Set.of("|", "but", "and");
    private static final int NEGATION_WINDOW = 3;
    private static final Pattern NUMBER = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\b");

    private final ConditionVocabulary vocabulary;

    public KeywordConditionExtractor(ConditionVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public Map<String, Object> extract(ExtractionContext context) {
        String text = normalize(context.text());
        if (text.isBlank()) {
            throw new ExtractionFailureException("answer is empty");
        }

        Map<String, Object> extracted = new LinkedHashMap<>();
        context.pendingQuestion()
            .filter(vocabulary::isKnownKey)
            .ifPresent(key -> answerPending(key, text, extracted));

        for (String key : vocabulary.keys()) {
            if (extracted.containsKey(key)) {
                continue;
            }
            if (vocabulary.isYesNo(key)) {
                findMention(key, text).ifPresent(value -> extracted.put(key, value));
            } else {
                findDomainValue(key, text).ifPresent(value -> extracted.put(key, value));
            }
        }

        if (extracted.isEmpty()) {
            throw new ExtractionFailureException("could not recognize any symptom in the answer: \"" + context.text() + "\"");
        }
        return extracted;
    }

    private void answerPending(String key, String text, Map<String, Object> extracted) {
        if (UNSURE.stream().anyMatch(phrase -> containsPhrase(text, phrase))) {
            extracted.put(key, null);
            return;
        }

        String first = text.split(" ")[0];
        if (vocabulary.isYesNo(key)) {
            if (AFFIRMATIVE.contains(first)) {
                extracted.put(key, Boolean.TRUE);
            } else if (NEGATIVE.contains(first)) {
                extracted.put(key, Boolean.FALSE);
            } else if (findMention(key, text).isEmpty() && opensNegated(text)) {
                extracted.put(key, Boolean.FALSE);
            }
            return;
        }

        Optional<String> word = findDomainValue(key, text);
        if (word.isPresent()) {
            extracted.put(key, word.get());
            return;
        }
        Matcher number = NUMBER.matcher(text);
        if (number.find()) {
            extracted.put(key, Double.parseDouble(number.group(1)));
        }
    }

    private Optional<Boolean> findMention(String key, String text) {
        ConditionDefinition def = vocabulary.definition(key).orElse(null);
        if (def == null) {
            return Optional.empty();
        }
        for (String alias : def.aliases()) {
            String phrase = normalize(alias);
            if (phrase.isBlank()) {
                continue;
            }
            int at = indexOfPhrase(text, phrase);
            if (at >= 0) {
                return Optional.of(!isNegated(text.substring(0, at)));
            }
        }
        return Optional.empty();
    }

    private Optional<String> findDomainValue(String key, String text) {
        for (String value : vocabulary.domain(key)) {
            if (containsPhrase(text, value.replace('_', ' '))) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private boolean isNegated(String before) {
        String trimmed = before.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String[] words = trimmed.split(" ");
        int stop = Math.max(0, words.length - NEGATION_WINDOW);
        for (int i = words.length - 1; i >= stop; i--) {
            if (CLAUSE_BREAKS.contains(words[i])) {
                return false;
            }
            if (NEGATORS.contains(words[i])) {
                return true;
            }
        }
        return false;
    }

    // "Not really", "He hasn't": a negator among the opening words of the first clause.
    private static boolean opensNegated(String text) {
        String[] words = text.split(" ");
        for (int i = 0; i < Math.min(words.length, NEGATION_WINDOW); i++) {
            if (CLAUSE_BREAKS.contains(words[i])) {
                return false;
            }
            if (NEGATORS.contains(words[i])) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsPhrase(String text, String phrase) {
        return indexOfPhrase(text, phrase) >= 0;
    }

    // Index of the phrase in text on word boundaries, or -1.
    private static int indexOfPhrase(String text, String phrase) {
        return (" " + text + " ").indexOf(" " + phrase + " ");
    }

    // Lower-cases and strips punctuation; clause punctuation becomes a "|" token.
    static String normalize(String raw) {
        return raw.toLowerCase(Locale.ROOT)
            .replace('\u2019', '\'')
            .replaceAll("[,;:!?]", " | ")
            .replaceAll("(?<!\\d)\\.|\\.(?!\\d)", " | ")
            .replaceAll("[^a-z0-9'.| ]", " ")
            .replaceAll("\\s+", " ")
            .replaceAll("^[| ]+|[| ]+$", "");
    }
}
