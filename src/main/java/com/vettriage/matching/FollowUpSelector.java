package com.vettriage.matching;

import com.vettriage.condition.ConditionView;
import com.vettriage.decision.DecisionLogger;
import com.vettriage.decision.DecisionStage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Picks the next question from a {@link MatchOutcome.PartialCandidates} outcome.
 *
 * Takes the missing keys of the top-ranked candidate and chooses the one that the most
 * other candidates are also missing, so a single answer settles as many rules as
 * possible. Ties go to the lexically smallest key. Keys the user already answered with
 * "unknown" are only asked again when nothing else is left for the top candidate.
 */
public class FollowUpSelector {

    public FollowUpChoice select(MatchOutcome.PartialCandidates outcome, ConditionView conditions,
                                 DecisionLogger logger) {
        PartialCandidate top = outcome.head();

        Set<String> answeredUnknown = conditions.unknownKeys();
        List<String> pool = new ArrayList<>();
        for (String key : top.missingKeys()) {
            if (!answeredUnknown.contains(key)) {
                pool.add(key);
            }
        }
        if (pool.isEmpty()) {
            pool.addAll(top.missingKeys());
        }

        String bestKey = null;
        int bestShare = -1;
        for (String key : pool) {
            int share = sharedBy(key, outcome.candidates(), top);
            if (share > bestShare || (share == bestShare && key.compareTo(bestKey) < 0)) {
                bestKey = key;
                bestShare = share;
            }
        }

        logger.record(DecisionStage.FOLLOW_UP_CHOSEN,
            "Asking about '%s' for top candidate %s (%d missing); %d other candidates also need it",
            bestKey, top.rule().code(), top.missingCount(), bestShare);
        return new FollowUpChoice(bestKey, top, bestShare);
    }

    private int sharedBy(String key, List<PartialCandidate> candidates, PartialCandidate top) {
        int count = 0;
        for (PartialCandidate candidate : candidates) {
            if (candidate != top && candidate.missingKeys().contains(key)) {
                count++;
            }
        }
        return count;
    }
}
