package com.vettriage.integration;

import com.vettriage.rules.TriageLevel;
import com.vettriage.session.SessionController;
import com.vettriage.session.SessionState;
import com.vettriage.session.TurnResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full conversations against the bundled catalog and the keyword extractor,
 * with the default policy of finalizing the first full match.
 */
@SpringBootTest
class TriageConversationIntegrationTest {

    @Autowired SessionController sessions;

    @Test
    @DisplayName("Vomiting dog: emergency patterns are ruled out before the urgent match")
    void vomitingDogConversation() {
        String sessionId = "it-" + UUID.randomUUID();

        TurnResult.FollowUp first = assertInstanceOf(TurnResult.FollowUp.class,
            sessions.submitAnswer(sessionId, "My dog has been vomiting"));
        assertEquals("breathing_difficulty", first.followUpKey());
        assertEquals("Is your pet having any trouble breathing?", first.followUpQuestion());
        assertEquals("dog", first.extractedConditions().get("species").value());

        TurnResult.FollowUp second = assertInstanceOf(TurnResult.FollowUp.class,
            sessions.submitAnswer(sessionId, "No"));
        assertEquals("toxin_exposure", second.followUpKey());

        TurnResult.FollowUp third = assertInstanceOf(TurnResult.FollowUp.class,
            sessions.submitAnswer(sessionId, "no, nothing like that"));
        assertEquals("seizure", third.followUpKey());

        TurnResult.FollowUp fourth = assertInstanceOf(TurnResult.FollowUp.class,
            sessions.submitAnswer(sessionId, "No"));
        assertEquals("lethargy", fourth.followUpKey());

        TurnResult.Triage triage = assertInstanceOf(TurnResult.Triage.class,
            sessions.submitAnswer(sessionId, "Yes, he is very tired"));
        assertEquals(TriageLevel.URGENT, triage.triageLevel());
        assertEquals("VT-GI-LETHARGY", triage.matchedRule());
        assertFalse(triage.fallback());
        assertEquals(SessionState.MATCHED, triage.state());
        assertEquals(5, sessions.snapshot(sessionId).orElseThrow().turnCount());
    }

    @Test
    @DisplayName("A single descriptive answer can finalize an emergency")
    void singleTurnEmergency() {
        TurnResult.Triage triage = assertInstanceOf(TurnResult.Triage.class,
            sessions.submitAnswer("it-" + UUID.randomUUID(), "My cat is not vomiting, but she keeps straining to pee"));

        assertEquals(TriageLevel.EMERGENCY, triage.triageLevel());
        assertEquals("VT-FLUTD", triage.matchedRule());
        assertEquals("no", triage.extractedConditions().get("vomiting").value());
    }

    @Test
    @DisplayName("Unrecognizable answer is an extraction failure")
    void unrecognizableAnswer() {
        String sessionId = "it-" + UUID.randomUUID();

        TurnResult.Error error = assertInstanceOf(TurnResult.Error.class,
            sessions.submitAnswer(sessionId, "the weather is lovely today"));

        assertEquals(TurnResult.ErrorCode.EXTRACTION_FAILED, error.errorCode());
        assertEquals(0, sessions.snapshot(sessionId).orElseThrow().turnCount());
    }

    @Test
    @DisplayName("Clear returns the opening prompt and forgets the conversation")
    void clearSession() {
        String sessionId = "it-" + UUID.randomUUID();
        sessions.submitAnswer(sessionId, "My dog has been vomiting");

        assertEquals("What symptoms is your pet experiencing?",
            sessions.clearSession(sessionId).followUpQuestion());
        assertTrue(sessions.snapshot(sessionId).orElseThrow().conditions().isEmpty());
    }
}
