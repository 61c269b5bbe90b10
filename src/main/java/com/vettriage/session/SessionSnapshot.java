package com.vettriage.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vettriage.condition.Condition;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of a session for display.
 */
public record SessionSnapshot(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("state") SessionState state,
    @JsonProperty("turn_count") int turnCount,
    @JsonProperty("pending_question_key") String pendingQuestionKey,
    @JsonProperty("conditions") Map<String, Condition> conditions,
    @JsonProperty("rule_checking_log") List<String> ruleCheckingLog
) {}
