package com.vettriage.session;

/**
 * Conversation lifecycle.
 *
 * INIT -> COLLECTING -> MATCHED; CLOSED is entered on an explicit clear and
 * immediately resets to INIT.
 */
public enum SessionState {
    INIT,
    COLLECTING,
    MATCHED,
    CLOSED
}
