package com.vettriage.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {

    private MutableClock clock;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = new InMemorySessionStore(clock, Duration.ofMinutes(30), Duration.ofMinutes(1));
    }

    @Test
    void getOrCreateReturnsTheSameSession() {
        Session first = store.getOrCreate("s-1");
        Session second = store.getOrCreate("s-1");

        assertSame(first, second);
        assertEquals(SessionState.INIT, first.state());
        assertEquals(1, store.size());
    }

    @Test
    void findDoesNotCreate() {
        assertTrue(store.find("missing").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void idleSessionsAreEvictedOnLaterAccess() {
        store.getOrCreate("idle");
        clock.advance(Duration.ofMinutes(20));
        store.getOrCreate("active");
        clock.advance(Duration.ofMinutes(15));

        assertTrue(store.find("idle").isEmpty());
        assertTrue(store.find("active").isPresent());
    }

    @Test
    void accessKeepsSessionAlive() {
        store.getOrCreate("s-1");
        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofMinutes(20));
            store.getOrCreate("s-1");
        }

        assertEquals(Instant.parse("2026-03-01T11:20:00Z"), store.find("s-1").orElseThrow().lastAccessedAt());
    }

    @Test
    void removeDropsSession() {
        store.getOrCreate("s-1");
        store.remove("s-1");

        assertTrue(store.find("s-1").isEmpty());
    }
}
