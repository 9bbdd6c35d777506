package net.proxymachine.model.fetch;

/**
 * Per-batch overrides for the configured fetch defaults.
 *
 * @param skipExisting count jobs whose destination already exists as skipped
 * @param concurrency  maximum jobs in flight
 */
public record FetchOptions(boolean skipExisting, int concurrency) {

    public FetchOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1 but was " + concurrency);
        }
    }

    public FetchOptions withSkipExisting(boolean value) {
        return new FetchOptions(value, concurrency);
    }
}
