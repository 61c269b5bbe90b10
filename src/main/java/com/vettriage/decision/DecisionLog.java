package com.vettriage.decision;

import java.util.List;

/**
 * The ordered reasoning trail of a single turn. Rebuilt from scratch every turn.
 */
public record DecisionLog(List<DecisionLogEntry> entries) {

    public static final DecisionLog EMPTY = new DecisionLog(List.of());

    public DecisionLog {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public List<String> render() {
        return entries.stream().map(DecisionLogEntry::render).toList();
    }

    public List<DecisionLogEntry> byStage(DecisionStage stage) {
        return entries.stream().filter(e -> e.stage() == stage).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
