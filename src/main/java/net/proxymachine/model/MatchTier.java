package net.proxymachine.model;

/**
 * How well a print's name matched a requested name, best first. Resolution tries the
 * tiers in declaration order and stops at the first one with candidates.
 */
public enum MatchTier {
    EXACT,
    PREFIX,
    CONTAINS
}
