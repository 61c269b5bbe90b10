package com.vettriage.matching;

/**
 * The single condition key to ask about next.
 *
 * @param key       condition key to ask about
 * @param target    the top-ranked candidate the key was taken from
 * @param sharedBy  number of other candidates that are also missing the key
 */
public record FollowUpChoice(String key, PartialCandidate target, int sharedBy) {}
