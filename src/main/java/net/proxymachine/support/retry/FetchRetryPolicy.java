package net.proxymachine.support.retry;

import net.proxymachine.config.FetchProperties;
import net.proxymachine.exception.RemoteFetchException;
import org.slf4j.Logger;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * The single retry policy shared by every network operation: bounded exponential
 * backoff with jitter, retrying only failures classified as transient.
 */
public final class FetchRetryPolicy {

    /**
     * Bundles the retry parameters.
     *
     * @param maxRetries retries after the first attempt
     * @param baseDelay  first backoff, doubled per retry
     * @param maxDelay   ceiling for one backoff
     * @param jitter     random jitter factor in [0, 1]
     */
    public record RetryConfig(int maxRetries, Duration baseDelay, Duration maxDelay, double jitter) {

        public RetryConfig {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be non-negative but was " + maxRetries);
            }
            if (jitter < 0d || jitter > 1d) {
                throw new IllegalArgumentException("jitter must be between 0 and 1 but was " + jitter);
            }
        }

        public static RetryConfig from(FetchProperties properties) {
            return new RetryConfig(properties.getMaxRetries(), properties.getBaseDelay(),
                properties.getMaxDelay(), properties.getJitter());
        }
    }

    private final RetryConfig config;

    public FetchRetryPolicy(RetryConfig config) {
        this.config = config;
    }

    public RetryConfig config() {
        return config;
    }

    /**
     * Upper bound on attempts for one operation, the first attempt included.
     */
    public int maxAttempts() {
        return 1 + config.maxRetries();
    }

    /**
     * Reactor retry spec for one operation. Errors must already be mapped to
     * {@link RemoteFetchException} (see {@link FetchFailureClassifier}); anything else is
     * not retried. When retries run out the last failure propagates unchanged.
     */
    public Retry toReactorRetry(String subject, Logger logger) {
        return Retry.backoff(config.maxRetries(), config.baseDelay())
            .maxBackoff(config.maxDelay())
            .jitter(config.jitter())
            .filter(FetchRetryPolicy::isRetryable)
            .doBeforeRetry(signal -> logger.warn("Retrying {} (retry {}/{}) [code={}]: {}",
                subject,
                signal.totalRetries() + 1,
                config.maxRetries(),
                codeOf(signal.failure()),
                signal.failure().getMessage()))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isRetryable(Throwable throwable) {
        return throwable instanceof RemoteFetchException remote && remote.isRetryable();
    }

    private static String codeOf(Throwable throwable) {
        if (throwable instanceof RemoteFetchException remote) {
            return remote.getErrorClass().name();
        }
        return throwable.getClass().getSimpleName();
    }
}
