package com.vettriage.matching;

import com.vettriage.condition.ConditionView;
import com.vettriage.decision.DecisionLogger;
import com.vettriage.decision.DecisionStage;
import com.vettriage.rules.Rule;
import com.vettriage.rules.RuleRepository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deterministic rule matcher.
 *
 * Evaluates the current conditions against every rule in the repository:
 * 1. Contradiction filter: a rule is eliminated when a known condition differs
 *    from the value it requires for the same key.
 * 2. Satisfaction scan: surviving rules are split into full matches (nothing missing)
 *    and partial candidates (some required keys absent or "unknown").
 * 3. Full-match tie-break: highest severity, then highest priority, then lowest id.
 * 4. Otherwise partial candidates ranked by fewest missing keys, then highest
 *    priority, then lowest id. No survivors at all gives {@link MatchOutcome.NoViableRule}.
 *
 * Pure and synchronous; holds no per-session state.
 */
public class RuleMatcher {

    static final Comparator<Rule> FULL_MATCH_ORDER = Comparator
        .comparingInt((Rule r) -> r.triageLevel().severity()).reversed()
        .thenComparing(Comparator.comparingInt(Rule::priority).reversed())
        .thenComparingInt(Rule::id);

    static final Comparator<PartialCandidate> CANDIDATE_ORDER = Comparator
        .comparingInt(PartialCandidate::missingCount)
        .thenComparing(Comparator.comparingInt((PartialCandidate c) -> c.rule().priority()).reversed())
        .thenComparingInt(c -> c.rule().id());

    private final RuleRepository repository;
    private final boolean preferHigherSeverityExploration;

    public RuleMatcher(RuleRepository repository, boolean preferHigherSeverityExploration) {
        this.repository = repository;
        this.preferHigherSeverityExploration = preferHigherSeverityExploration;
    }

    public MatchOutcome match(ConditionView conditions) {
        return match(conditions, DecisionLogger.forTurn(Clock.systemUTC()));
    }

    public MatchOutcome match(ConditionView conditions, DecisionLogger logger) {
        Set<String> knownKeys = new TreeSet<>();
        for (String key : conditions.keys()) {
            if (conditions.isKnown(key)) {
                knownKeys.add(key);
            }
        }

        Set<Rule> referencing = new LinkedHashSet<>();
        for (String key : knownKeys) {
            referencing.addAll(repository.candidatesFor(key));
        }
        logger.record(DecisionStage.CANDIDATE_SCAN,
            "Scanning %d rules against %d known conditions %s; %d rules reference them",
            repository.size(), knownKeys.size(), knownKeys, referencing.size());

        Map<Rule, String> contradicted = findContradictions(conditions, knownKeys, logger);

        List<Rule> fullMatches = new ArrayList<>();
        List<PartialCandidate> partials = new ArrayList<>();
        for (Rule rule : repository.all()) {
            if (contradicted.containsKey(rule)) {
                continue;
            }
            List<String> missing = new ArrayList<>();
            for (String key : rule.requiredKeys()) {
                if (!conditions.isKnown(key)) {
                    missing.add(key);
                }
            }
            if (missing.isEmpty()) {
                fullMatches.add(rule);
            } else {
                partials.add(new PartialCandidate(rule, missing));
            }
        }

        if (fullMatches.isEmpty() && partials.isEmpty()) {
            logger.record(DecisionStage.CONTRADICTION_CHECK,
                "All %d rules contradicted by asserted conditions; no viable rule", contradicted.size());
            return new MatchOutcome.NoViableRule(contradicted.size());
        }

        partials.sort(CANDIDATE_ORDER);

        if (!fullMatches.isEmpty()) {
            fullMatches.sort(FULL_MATCH_ORDER);
            Rule winner = fullMatches.get(0);

            if (preferHigherSeverityExploration) {
                List<PartialCandidate> moreSevere = partials.stream()
                    .filter(c -> c.rule().triageLevel().isMoreSevereThan(winner.triageLevel()))
                    .toList();
                if (!moreSevere.isEmpty()) {
                    logger.record(DecisionStage.MATCH_FOUND,
                        "Rule %s (%s) fully satisfied at %s but deferred: %d higher-severity candidates still open, led by %s",
                        winner.code(), winner.name(), winner.triageLevel().getValue(),
                        moreSevere.size(), moreSevere.get(0).rule().code());
                    return new MatchOutcome.PartialCandidates(moreSevere, winner);
                }
            }

            logger.record(DecisionStage.MATCH_FOUND, describeFullMatch(winner, fullMatches));
            return new MatchOutcome.FullMatch(winner, fullMatches.subList(1, fullMatches.size()));
        }

        PartialCandidate head = partials.get(0);
        logger.record(DecisionStage.CANDIDATE_SCAN,
            "No full match; %d partial candidates, top %s (%s) satisfied %d/%d, missing %s",
            partials.size(), head.rule().code(), head.rule().name(),
            head.satisfiedCount(), head.rule().requiredConditions().size(), head.missingKeys());
        return new MatchOutcome.PartialCandidates(partials, null);
    }

    // Only rules indexed under a known key can be contradicted.
    private Map<Rule, String> findContradictions(ConditionView conditions, Set<String> knownKeys,
                                                 DecisionLogger logger) {
        Map<Rule, String> contradicted = new LinkedHashMap<>();
        for (String key : knownKeys) {
            String asserted = conditions.knownValue(key).orElseThrow();
            for (Rule rule : repository.candidatesFor(key)) {
                String required = rule.requiredValue(key);
                if (!asserted.equals(required) && !contradicted.containsKey(rule)) {
                    String reason = key + "=" + asserted + " contradicts required " + required;
                    contradicted.put(rule, reason);
                    logger.record(DecisionStage.CONTRADICTION_CHECK,
                        "Rule %s (%s) eliminated: %s", rule.code(), rule.name(), reason);
                }
            }
        }
        if (contradicted.isEmpty() && !knownKeys.isEmpty()) {
            logger.record(DecisionStage.CONTRADICTION_CHECK, "No rule contradicted by known conditions");
        }
        return contradicted;
    }

    private String describeFullMatch(Rule winner, List<Rule> fullMatches) {
        String base = "Rule " + winner.code() + " (" + winner.name() + ") fully satisfied, triage level "
            + winner.triageLevel().getValue();
        if (fullMatches.size() == 1) {
            return base;
        }
        List<String> others = fullMatches.subList(1, fullMatches.size()).stream().map(Rule::code).toList();
        return base + "; chosen over " + others + " by severity, priority, then id";
    }
}
