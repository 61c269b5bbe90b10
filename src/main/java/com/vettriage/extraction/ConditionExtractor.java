package com.vettriage.extraction;

import java.util.Map;

/**
 * Turns free-form symptom text into loosely typed key/value pairs.
 *
 * The output is not trusted: it is normalized against the condition vocabulary
 * before being merged, so implementations may return raw booleans, strings,
 * numbers, nulls or nested symptom objects.
 */
public interface ConditionExtractor {

    /**
     * @throws ExtractionFailureException if no conditions can be produced from the text
     */
    Map<String, Object> extract(ExtractionContext context);
}
