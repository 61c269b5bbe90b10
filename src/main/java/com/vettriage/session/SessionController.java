package com.vettriage.session;

import com.vettriage.catalog.ConditionVocabulary;
import com.vettriage.catalog.QuestionTemplates;
import com.vettriage.condition.Condition;
import com.vettriage.condition.ConditionSet;
import com.vettriage.config.TriageProperties;
import com.vettriage.decision.DecisionLog;
import com.vettriage.decision.DecisionLogger;
import com.vettriage.decision.DecisionStage;
import com.vettriage.extraction.ConditionExtractor;
import com.vettriage.extraction.ExtractionContext;
import com.vettriage.extraction.ExtractionFailureException;
import com.vettriage.matching.FollowUpChoice;
import com.vettriage.matching.FollowUpSelector;
import com.vettriage.matching.MatchOutcome;
import com.vettriage.matching.PartialCandidate;
import com.vettriage.matching.RuleMatcher;
import com.vettriage.rules.Rule;
import com.vettriage.rules.TriageLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orchestrates conversational turns.
 *
 * A turn extracts conditions from the answer, merges them into the session's
 * condition set, runs the matcher and then either asks a follow-up question or
 * finalizes a triage. Turns on the same session are serialized on the session's
 * monitor; turns on different sessions run independently.
 *
 * Fallback policy: when no rule is viable or the turn budget is spent, the session
 * still ends with advice, at the lowest severity.
 */
@Service
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionStore sessionStore;
    private final ConditionExtractor extractor;
    private final ConditionVocabulary vocabulary;
    private final RuleMatcher matcher;
    private final FollowUpSelector selector;
    private final QuestionTemplates questions;
    private final TriageProperties properties;
    private final Clock clock;

    public SessionController(SessionStore sessionStore,
                             ConditionExtractor extractor,
                             ConditionVocabulary vocabulary,
                             RuleMatcher matcher,
                             FollowUpSelector selector,
                             QuestionTemplates questions,
                             TriageProperties properties,
                             Clock clock) {
        this.sessionStore = sessionStore;
        this.extractor = extractor;
        this.vocabulary = vocabulary;
        this.matcher = matcher;
        this.selector = selector;
        this.questions = questions;
        this.properties = properties;
        this.clock = clock;
    }

    public TurnResult submitAnswer(String sessionId, String rawText) {
        if (sessionId == null || sessionId.isBlank()) {
            return new TurnResult.Error(TurnResult.ErrorCode.INVALID_INPUT, "session id is required");
        }
        if (rawText == null || rawText.isBlank()) {
            return new TurnResult.Error(TurnResult.ErrorCode.INVALID_INPUT, "answer text is required");
        }

        Session session = sessionStore.getOrCreate(sessionId);
        synchronized (session) {
            return runTurn(session, rawText.trim());
        }
    }

    public OpeningPrompt clearSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id is required");
        }
        Session session = sessionStore.getOrCreate(sessionId);
        synchronized (session) {
            SessionState previous = session.state();
            session.reset();
            log.info("Session {} cleared ({} -> {} -> {})", sessionId, previous, SessionState.CLOSED, session.state());
            return new OpeningPrompt(sessionId, session.state(), properties.openingPrompt());
        }
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        return sessionStore.find(sessionId).map(session -> {
            synchronized (session) {
                return new SessionSnapshot(session.id(), session.state(), session.turnCount(),
                    session.pendingQuestionKey(), session.conditions().asMap(),
                    session.lastDecisionLog().render());
            }
        });
    }

    private TurnResult runTurn(Session session, String text) {
        Map<String, Object> raw;
        try {
            raw = extractor.extract(new ExtractionContext(text, session.conditions().copy(),
                session.pendingQuestionKey()));
        } catch (ExtractionFailureException ex) {
            log.warn("Extraction failed for session {}: {}", session.id(), ex.getMessage());
            return new TurnResult.Error(TurnResult.ErrorCode.EXTRACTION_FAILED, ex.getMessage());
        }

        ConditionVocabulary.NormalizedConditions normalized = vocabulary.normalizeAll(raw);
        if (!normalized.ignored().isEmpty()) {
            log.warn("Session {}: quarantined unrecognized conditions {}", session.id(), normalized.ignored());
        }
        if (normalized.accepted().isEmpty()) {
            return new TurnResult.Error(TurnResult.ErrorCode.EXTRACTION_FAILED,
                "no recognized conditions in the answer; ignored " + normalized.ignored());
        }

        if (session.isTerminal()) {
            log.info("Session {} received an answer after triage; continuing with existing conditions", session.id());
            session.reopen();
        }

        ConditionSet conditions = session.conditions();
        conditions.confirmAll();
        for (Condition condition : normalized.accepted()) {
            conditions.assertCondition(condition);
        }
        session.beginTurn();

        DecisionLogger logger = DecisionLogger.forTurn(clock);
        ConditionSet view = conditions.copy();
        MatchOutcome outcome = matcher.match(view, logger);

        TurnResult result;
        if (outcome instanceof MatchOutcome.FullMatch full) {
            result = finish(session, full.rule(), false, full.rule().advice(), normalized.ignored(), logger);
        } else if (outcome instanceof MatchOutcome.PartialCandidates partial) {
            result = continueOrFinish(session, partial, view, normalized.ignored(), logger);
        } else {
            logger.record(DecisionStage.MATCH_FOUND, "No viable rule; finalizing with fallback advice");
            result = fallback(session, null, normalized.ignored(), logger);
        }

        log.info("Session {} turn {} -> {}", session.id(), session.turnCount(), session.state());
        return result;
    }

    private TurnResult continueOrFinish(Session session, MatchOutcome.PartialCandidates partial,
                                        ConditionSet view, List<String> ignored, DecisionLogger logger) {
        if (session.turnCount() >= properties.maxTurns()) {
            Optional<Rule> deferred = partial.deferred();
            if (deferred.isPresent()) {
                Rule rule = deferred.get();
                logger.record(DecisionStage.MATCH_FOUND,
                    "Turn budget of %d exhausted; finalizing with deferred full match %s",
                    properties.maxTurns(), rule.code());
                return finish(session, rule, false, rule.advice(), ignored, logger);
            }
            logger.record(DecisionStage.MATCH_FOUND,
                "Turn budget of %d exhausted; finalizing best effort from candidate %s",
                properties.maxTurns(), partial.head().rule().code());
            return fallback(session, partial.head(), ignored, logger);
        }

        FollowUpChoice choice = selector.select(partial, view, logger);
        DecisionLog decisionLog = logger.toLog();
        session.awaitAnswer(choice.key(), decisionLog);
        return new TurnResult.FollowUp(session.id(), session.state(), choice.key(),
            questions.questionFor(choice.key()), session.conditions().asMap(), ignored, decisionLog.render());
    }

    private TurnResult fallback(Session session, PartialCandidate closest, List<String> ignored,
                                DecisionLogger logger) {
        String advice = properties.fallbackAdvice();
        String ruleCode = null;
        if (closest != null) {
            ruleCode = closest.rule().code();
            advice = advice + " Closest pattern: " + closest.rule().name()
                + " (" + closest.missingCount() + " details unconfirmed).";
        }
        DecisionLog decisionLog = logger.toLog();
        session.finish(decisionLog);
        return new TurnResult.Triage(session.id(), session.state(), TriageLevel.lowest(), advice, ruleCode, true,
            session.conditions().asMap(), ignored, decisionLog.render());
    }

    private TurnResult finish(Session session, Rule rule, boolean fallback, String advice,
                              List<String> ignored, DecisionLogger logger) {
        DecisionLog decisionLog = logger.toLog();
        session.finish(decisionLog);
        log.info("Session {} matched rule {} ({})", session.id(), rule.code(), rule.triageLevel().getValue());
        return new TurnResult.Triage(session.id(), session.state(), rule.triageLevel(), advice, rule.code(), fallback,
            session.conditions().asMap(), ignored, decisionLog.render());
    }
}
