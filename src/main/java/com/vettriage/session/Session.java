package com.vettriage.session;

import com.vettriage.condition.ConditionSet;
import com.vettriage.decision.DecisionLog;

import java.time.Instant;
import java.util.Objects;

/**
 * State of one conversation. Owned and mutated only by {@link SessionController},
 * which holds the session's monitor for the duration of a turn.
 */
public class Session {

    private final String id;
    private final ConditionSet conditions = new ConditionSet();

    private SessionState state = SessionState.INIT;
    private int turnCount;
    private String pendingQuestionKey;
    private DecisionLog lastDecisionLog = DecisionLog.EMPTY;
    private volatile Instant lastAccessedAt;

    public Session(String id, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.lastAccessedAt = createdAt;
    }

    public String id() {
        return id;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    public void touch(Instant now) {
        this.lastAccessedAt = now;
    }

    public ConditionSet conditions() {
        return conditions;
    }

    public SessionState state() {
        return state;
    }

    public int turnCount() {
        return turnCount;
    }

    public String pendingQuestionKey() {
        return pendingQuestionKey;
    }

    public DecisionLog lastDecisionLog() {
        return lastDecisionLog;
    }

    public boolean isTerminal() {
        return state == SessionState.MATCHED;
    }

    /** Starts a counted turn; the session is collecting until a terminal outcome. */
    void beginTurn() {
        state = SessionState.COLLECTING;
        turnCount++;
    }

    void awaitAnswer(String questionKey, DecisionLog log) {
        pendingQuestionKey = questionKey;
        lastDecisionLog = log;
    }

    void finish(DecisionLog log) {
        state = SessionState.MATCHED;
        pendingQuestionKey = null;
        lastDecisionLog = log;
    }

    /** Continues a finished conversation with its conditions kept and a fresh turn budget. */
    void reopen() {
        state = SessionState.COLLECTING;
        turnCount = 0;
    }

    /** Discards conditions, turn counter and decision log. */
    void reset() {
        state = SessionState.CLOSED;
        conditions.clear();
        turnCount = 0;
        pendingQuestionKey = null;
        lastDecisionLog = DecisionLog.EMPTY;
        state = SessionState.INIT;
    }
}
