package net.proxymachine.model.classify;

/**
 * Primary card type used to group non-land, non-token prints, in precedence order
 * (an "Artifact Creature" is a creature).
 */
public enum CardTypeBucket {
    CREATURE("creatures", "creature"),
    PLANESWALKER("planeswalkers", "planeswalker"),
    BATTLE("battles", "battle"),
    INSTANT("instants", "instant"),
    SORCERY("sorceries", "sorcery"),
    ARTIFACT("artifacts", "artifact"),
    ENCHANTMENT("enchantments", "enchantment"),
    LAND("lands", "land"),
    OTHER("other", null);

    private final String directory;
    private final String typeWord;

    CardTypeBucket(String directory, String typeWord) {
        this.directory = directory;
        this.typeWord = typeWord;
    }

    public String directory() {
        return directory;
    }

    /**
     * Lower-case type word searched for in the type line, or null for {@link #OTHER}.
     */
    public String typeWord() {
        return typeWord;
    }
}
