package com.vettriage.matching;

import com.vettriage.rules.Rule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one matcher pass. Recomputed every turn, never persisted.
 */
public sealed interface MatchOutcome {

    /**
     * A rule whose every required condition holds.
     *
     * @param rule          the tie-break winner
     * @param alsoSatisfied other fully satisfied rules, in tie-break order
     */
    record FullMatch(Rule rule, List<Rule> alsoSatisfied) implements MatchOutcome {
        public FullMatch {
            Objects.requireNonNull(rule, "rule");
            alsoSatisfied = List.copyOf(alsoSatisfied);
        }
    }

    /**
     * No full match to report yet.
     *
     * @param candidates    surviving rules ranked by fewest missing keys, then priority, then id
     * @param deferredMatch a full match held back while higher-severity candidates are explored;
     *                      null unless severity exploration is enabled
     */
    record PartialCandidates(List<PartialCandidate> candidates, Rule deferredMatch) implements MatchOutcome {
        public PartialCandidates {
            candidates = List.copyOf(candidates);
            if (candidates.isEmpty()) {
                throw new IllegalArgumentException("partial candidates cannot be empty");
            }
        }

        public PartialCandidate head() {
            return candidates.get(0);
        }

        public Optional<Rule> deferred() {
            return Optional.ofNullable(deferredMatch);
        }
    }

    /**
     * Every rule is contradicted by at least one asserted condition.
     */
    record NoViableRule(int contradictedRules) implements MatchOutcome {}
}
