package com.vettriage.session;

import java.util.Optional;

public interface SessionStore {

    /** Returns the session for the id, creating an empty one if it does not exist. */
    Session getOrCreate(String sessionId);

    Optional<Session> find(String sessionId);

    void remove(String sessionId);

    int size();
}
