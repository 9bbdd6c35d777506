package net.proxymachine.exception;

import java.nio.file.Path;

/**
 * Output location cannot take the batch (not enough free space, not writable).
 * Environment-level: aborts the whole batch instead of failing jobs one by one.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(Path outputRoot, String reason) {
        super("Output storage unavailable at " + outputRoot + ": " + reason);
    }

    public StorageUnavailableException(Path outputRoot, String reason, Throwable cause) {
        super("Output storage unavailable at " + outputRoot + ": " + reason, cause);
    }
}
