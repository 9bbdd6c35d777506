package net.proxymachine.model.classify;

/**
 * Directory bucket for a token. Creature tokens are grouped by subtype and
 * power/toughness, everything else by a small set of well-known kinds.
 *
 * @param creature       whether the token is a creature
 * @param group          creature subtype slug, or the non-creature kind
 * @param powerToughness {@code "<power>-<toughness>"} or {@code "unknown"}; null for non-creatures
 */
public record TokenBucket(boolean creature, String group, String powerToughness) {

    public static final String UNKNOWN_POWER_TOUGHNESS = "unknown";

    public static TokenBucket creature(String subtype, String powerToughness) {
        return new TokenBucket(true, subtype, powerToughness);
    }

    public static TokenBucket nonCreature(String kind) {
        return new TokenBucket(false, kind, null);
    }

    /**
     * Relative directory, e.g. {@code creature/goblin/1-1} or {@code noncreature/treasure}.
     */
    public String relativePath() {
        if (creature) {
            return "creature/" + group + "/" + powerToughness;
        }
        return "noncreature/" + group;
    }
}
