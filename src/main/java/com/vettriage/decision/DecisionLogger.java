package com.vettriage.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Records matcher and selector stages for one turn. A new instance is created per
 * turn and discarded once {@link #toLog()} has been taken; nothing is shared
 * between turns.
 *
 * Entries are mirrored to the application log at DEBUG.
 */
public class DecisionLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionLogger.class);

    private final Clock clock;
    private final List<DecisionLogEntry> entries = new ArrayList<>();

    public DecisionLogger(Clock clock) {
        this.clock = clock;
    }

    public static DecisionLogger forTurn(Clock clock) {
        return new DecisionLogger(clock);
    }

    public void record(DecisionStage stage, String message) {
        DecisionLogEntry entry = new DecisionLogEntry(stage, message, clock.instant());
        entries.add(entry);
        log.debug("{}", entry.render());
    }

    public void record(DecisionStage stage, String format, Object... args) {
        record(stage, String.format(format, args));
    }

    public DecisionLog toLog() {
        return new DecisionLog(entries);
    }
}
