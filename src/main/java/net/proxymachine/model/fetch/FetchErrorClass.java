package net.proxymachine.model.fetch;

/**
 * Failure categories recorded on failed fetch results. The retryable flag drives the
 * shared retry policy.
 */
public enum FetchErrorClass {
    TIMEOUT(true),
    CONNECTION(true),
    HTTP_RETRYABLE(true),
    HTTP_CLIENT(false),
    INVALID_URI(false),
    IO(false),
    CANCELLED(false),
    UNKNOWN(false);

    private final boolean retryable;

    FetchErrorClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * 429 and every 5xx are transient; every other non-2xx status is final.
     */
    public static FetchErrorClass forHttpStatus(int statusCode) {
        if (statusCode == 429 || statusCode >= 500) {
            return HTTP_RETRYABLE;
        }
        return HTTP_CLIENT;
    }
}
