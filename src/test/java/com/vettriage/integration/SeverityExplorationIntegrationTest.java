package com.vettriage.integration;

import com.vettriage.rules.TriageLevel;
import com.vettriage.session.SessionController;
import com.vettriage.session.TurnResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Same conversation as {@link TriageConversationIntegrationTest}, but with the engine
 * configured to rule out higher-severity patterns before settling on a full match.
 */
@SpringBootTest(properties = "triage.prefer-higher-severity-exploration=true")
class SeverityExplorationIntegrationTest {

    @Autowired SessionController sessions;

    @Test
    @DisplayName("Urgent match is held back until emergency candidates are ruled out")
    void urgentMatchIsDeferred() {
        String sessionId = "it-" + UUID.randomUUID();
        sessions.submitAnswer(sessionId, "My dog has been vomiting");
        sessions.submitAnswer(sessionId, "No");
        sessions.submitAnswer(sessionId, "No");
        sessions.submitAnswer(sessionId, "No");

        TurnResult.FollowUp paleGums = assertInstanceOf(TurnResult.FollowUp.class,
            sessions.submitAnswer(sessionId, "Yes, he is very tired"));
        assertEquals("pale_gums", paleGums.followUpKey());
        assertTrue(paleGums.ruleCheckingLog().stream().anyMatch(l -> l.contains("deferred")));

        TurnResult.FollowUp bloat = assertInstanceOf(TurnResult.FollowUp.class,
            sessions.submitAnswer(sessionId, "no, they look pink"));
        assertEquals("abdominal_distension", bloat.followUpKey());

        TurnResult.Triage triage = assertInstanceOf(TurnResult.Triage.class,
            sessions.submitAnswer(sessionId, "no"));
        assertEquals(TriageLevel.URGENT, triage.triageLevel());
        assertEquals("VT-GI-LETHARGY", triage.matchedRule());
        assertEquals(7, sessions.snapshot(sessionId).orElseThrow().turnCount());
    }
}
