package net.proxymachine.model.fetch;

import java.time.Duration;

/**
 * Outcome of one fetch job. Failed results carry the error class and message so the
 * failed subset can be reported and re-run.
 */
public record FetchResult(FetchJob job,
                          FetchStatus status,
                          long bytes,
                          Duration elapsed,
                          int attempts,
                          FetchErrorClass errorClass,
                          String errorMessage) {

    public static FetchResult success(FetchJob job, long bytes, Duration elapsed, int attempts) {
        return new FetchResult(job, FetchStatus.SUCCESS, bytes, elapsed, attempts, null, null);
    }

    public static FetchResult skipped(FetchJob job) {
        return new FetchResult(job, FetchStatus.SKIPPED, 0L, Duration.ZERO, 0, null, null);
    }

    public static FetchResult failure(FetchJob job, Duration elapsed, int attempts,
                                      FetchErrorClass errorClass, String errorMessage) {
        return new FetchResult(job, FetchStatus.FAILED, 0L, elapsed, attempts, errorClass, errorMessage);
    }

    /**
     * Failure for a job that was never started because its batch was cancelled.
     */
    public static FetchResult cancelled(FetchJob job) {
        return new FetchResult(job, FetchStatus.FAILED, 0L, Duration.ZERO, 0,
            FetchErrorClass.CANCELLED, "batch cancelled before the job started");
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }
}
