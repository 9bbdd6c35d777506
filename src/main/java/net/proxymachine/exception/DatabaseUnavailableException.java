package net.proxymachine.exception;

import java.nio.file.Path;

/**
 * Card index file is missing, corrupt, or built with an incompatible schema. Callers
 * surface {@link #getRemediation()} instead of returning partial results.
 * RETRYABLE: No (rebuild the index first)
 */
public class DatabaseUnavailableException extends RuntimeException {

    public static final String REBUILD_HINT = "rebuild the card index from a catalog dump";

    private final transient Path databasePath;

    public DatabaseUnavailableException(Path databasePath, String reason) {
        this(databasePath, reason, null);
    }

    public DatabaseUnavailableException(Path databasePath, String reason, Throwable cause) {
        super("Card index unavailable at " + databasePath + ": " + reason + " (" + REBUILD_HINT + ")", cause);
        this.databasePath = databasePath;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public String getRemediation() {
        return REBUILD_HINT;
    }
}
