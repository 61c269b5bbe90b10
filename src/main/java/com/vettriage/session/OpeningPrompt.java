package com.vettriage.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Returned by {@code clearSession}: the question that starts a new conversation.
 */
public record OpeningPrompt(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("state") SessionState state,
    @JsonProperty("follow_up_question") String followUpQuestion
) {}
