package com.vettriage.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static lookup from condition key to the question asked for it.
 */
public final class QuestionTemplates {

    private final Map<String, String> templates;
    private final ConditionVocabulary vocabulary;

    public QuestionTemplates(Map<String, String> templates, ConditionVocabulary vocabulary) {
        this.templates = Map.copyOf(templates);
        this.vocabulary = vocabulary;
    }

    public static QuestionTemplates from(ConditionVocabulary vocabulary) {
        Map<String, String> templates = new LinkedHashMap<>();
        for (String key : vocabulary.keys()) {
            vocabulary.definition(key)
                .map(ConditionDefinition::question)
                .filter(q -> !q.isBlank())
                .ifPresent(q -> templates.put(key, q));
        }
        return new QuestionTemplates(templates, vocabulary);
    }

    public String questionFor(String key) {
        String template = templates.get(key);
        if (template != null) {
            return template;
        }
        return "Can you tell me more about " + vocabulary.displayName(key) + "?";
    }

    public boolean hasTemplate(String key) {
        return templates.containsKey(key);
    }
}
