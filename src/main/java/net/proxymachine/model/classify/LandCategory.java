package net.proxymachine.model.classify;

/**
 * Directory bucket for lands. Anything that is not a basic land and not a clean
 * two- or three-color producer is {@link #SPECIAL}.
 */
public enum LandCategory {
    BASIC("basic"),
    DUAL("dual"),
    TRI("tri"),
    SPECIAL("special");

    private final String directory;

    LandCategory(String directory) {
        this.directory = directory;
    }

    public String directory() {
        return directory;
    }
}
