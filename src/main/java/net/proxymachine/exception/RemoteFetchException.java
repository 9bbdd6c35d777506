package net.proxymachine.exception;

import net.proxymachine.model.fetch.FetchErrorClass;

/**
 * A download (card image or bulk catalog) failed. Whether it may be retried follows from
 * its {@link FetchErrorClass}: timeouts, connection failures, 429 and 5xx are transient;
 * other 4xx, malformed URIs and local write errors are not.
 */
public class RemoteFetchException extends RuntimeException {

    private final String subject;
    private final String sourceUri;
    private final FetchErrorClass errorClass;
    private final Integer statusCode;

    public RemoteFetchException(String subject, String sourceUri, FetchErrorClass errorClass,
                                Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
        this.sourceUri = sourceUri;
        this.errorClass = errorClass;
        this.statusCode = statusCode;
    }

    public static RemoteFetchException invalidUri(String subject, String sourceUri, String reason) {
        return new RemoteFetchException(subject, sourceUri, FetchErrorClass.INVALID_URI, null,
            "Invalid URI for " + subject + " (" + sourceUri + "): " + reason, null);
    }

    public static RemoteFetchException httpStatus(String subject, String sourceUri, int statusCode, Throwable cause) {
        return new RemoteFetchException(subject, sourceUri, FetchErrorClass.forHttpStatus(statusCode), statusCode,
            "HTTP " + statusCode + " fetching " + subject + " from " + sourceUri, cause);
    }

    /**
     * What was being fetched: a print id or a bulk-data type.
     */
    public String getSubject() {
        return subject;
    }

    public String getSourceUri() {
        return sourceUri;
    }

    public FetchErrorClass getErrorClass() {
        return errorClass;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return errorClass.isRetryable();
    }
}
