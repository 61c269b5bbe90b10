package com.vettriage.catalog;

import com.vettriage.rules.RuleRepository;

/**
 * Everything materialized from one catalog document.
 */
public record RuleCatalog(
    RuleRepository rules,
    ConditionVocabulary vocabulary,
    QuestionTemplates questions
) {}
