package com.vettriage.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vettriage.condition.Condition;
import com.vettriage.rules.TriageLevel;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code submitAnswer} call.
 */
public sealed interface TurnResult {

    /**
     * The engine needs one more fact before it can triage.
     */
    record FollowUp(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("state") SessionState state,
        @JsonProperty("follow_up_key") String followUpKey,
        @JsonProperty("follow_up_question") String followUpQuestion,
        @JsonProperty("extracted_conditions") Map<String, Condition> extractedConditions,
        @JsonProperty("ignored_conditions") List<String> ignoredConditions,
        @JsonProperty("rule_checking_log") List<String> ruleCheckingLog
    ) implements TurnResult {}

    /**
     * Terminal outcome: a full match, or a fallback when no confident match exists.
     *
     * @param matchedRule code of the matched rule, or of the closest candidate for a fallback; may be null
     * @param fallback    true when the outcome is not a full match
     */
    record Triage(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("state") SessionState state,
        @JsonProperty("triage_level") TriageLevel triageLevel,
        @JsonProperty("advice") String advice,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("matched_rule") String matchedRule,
        @JsonProperty("fallback") boolean fallback,
        @JsonProperty("extracted_conditions") Map<String, Condition> extractedConditions,
        @JsonProperty("ignored_conditions") List<String> ignoredConditions,
        @JsonProperty("rule_checking_log") List<String> ruleCheckingLog
    ) implements TurnResult {}

    /**
     * The turn could not be processed. The session was not modified.
     */
    record Error(
        @JsonProperty("error_code") ErrorCode errorCode,
        @JsonProperty("error") String error
    ) implements TurnResult {}

    enum ErrorCode {
        INVALID_INPUT,
        EXTRACTION_FAILED
    }
}
