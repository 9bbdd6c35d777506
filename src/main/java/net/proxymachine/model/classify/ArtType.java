package net.proxymachine.model.classify;

/**
 * Art treatment of a print, declared in priority order: when several signals apply the
 * first constant wins.
 */
public enum ArtType {
    TEXTLESS("textless"),
    BORDERLESS("borderless"),
    SHOWCASE("showcase"),
    EXTENDED("extended"),
    RETRO("retro"),
    FULLART("fullart"),
    STANDARD("standard");

    private final String label;

    ArtType(String label) {
        this.label = label;
    }

    /**
     * Label used in file names.
     */
    public String label() {
        return label;
    }
}
