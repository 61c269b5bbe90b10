package com.vettriage.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local session store with idle expiry.
 *
 * Expired sessions are swept lazily on access, at most once per sweep interval,
 * so the store never runs a background thread.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private final AtomicReference<Instant> lastSweep;

    public InMemorySessionStore(Clock clock, Duration idleTimeout, Duration sweepInterval) {
        this.clock = clock;
        this.idleTimeout = idleTimeout;
        this.sweepInterval = sweepInterval;
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    @Override
    public Session getOrCreate(String sessionId) {
        Instant now = clock.instant();
        sweepIfDue(now);
        Session session = sessions.computeIfAbsent(sessionId, id -> {
            log.info("Created session {}", id);
            return new Session(id, now);
        });
        session.touch(now);
        return session;
    }

    @Override
    public Optional<Session> find(String sessionId) {
        Instant now = clock.instant();
        sweepIfDue(now);
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private void sweepIfDue(Instant now) {
        Instant previous = lastSweep.get();
        if (Duration.between(previous, now).compareTo(sweepInterval) < 0
            || !lastSweep.compareAndSet(previous, now)) {
            return;
        }
        Instant cutoff = now.minus(idleTimeout);
        int before = sessions.size();
        sessions.values().removeIf(s -> s.lastAccessedAt().isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} sessions idle since before {}", evicted, cutoff);
        }
    }
}
