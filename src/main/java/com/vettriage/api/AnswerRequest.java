package com.vettriage.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/triage/sessions/{sessionId}/answers}.
 */
public record AnswerRequest(@JsonProperty("user_answer") String userAnswer) {}
