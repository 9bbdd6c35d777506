package net.proxymachine.exception;

import java.util.List;

/**
 * Input rejected before any work started: an unreadable catalog file, a malformed query
 * filter or an invalid fetch batch.
 * RETRYABLE: No (the caller must fix the input)
 */
public class ValidationException extends RuntimeException {

    private final List<String> issues;

    public ValidationException(String message) {
        this(message, List.of(), null);
    }

    public ValidationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ValidationException(String message, List<String> issues, Throwable cause) {
        super(message, cause);
        this.issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Individual problems found, when the validation collected more than one.
     */
    public List<String> getIssues() {
        return issues;
    }
}
