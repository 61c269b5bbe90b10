package com.vettriage.extraction;

import com.vettriage.condition.ConditionView;

import java.util.Objects;
import java.util.Optional;

/**
 * Input to one extraction call.
 *
 * @param text               the user's raw answer
 * @param priorConditions    read-only snapshot of the conditions known before this turn
 * @param pendingQuestionKey condition key of the follow-up question just asked, or null
 */
public record ExtractionContext(String text, ConditionView priorConditions, String pendingQuestionKey) {

    public ExtractionContext {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(priorConditions, "priorConditions");
    }

    public Optional<String> pendingQuestion() {
        return Optional.ofNullable(pendingQuestionKey);
    }
}
