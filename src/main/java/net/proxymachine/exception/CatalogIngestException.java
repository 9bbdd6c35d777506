package net.proxymachine.exception;

import java.nio.file.Path;

/**
 * Catalog dump is missing, unreadable, or in neither of the supported layouts
 * (JSON array or line-delimited objects).
 * RETRYABLE: No
 */
public class CatalogIngestException extends ValidationException {

    private final transient Path source;

    public CatalogIngestException(Path source, String message) {
        super("Cannot ingest catalog " + source + ": " + message);
        this.source = source;
    }

    public CatalogIngestException(Path source, String message, Throwable cause) {
        super("Cannot ingest catalog " + source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
