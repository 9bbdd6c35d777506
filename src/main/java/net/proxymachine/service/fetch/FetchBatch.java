package net.proxymachine.service.fetch;

import net.proxymachine.model.fetch.FetchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a running fetch batch. Cancelling stops new jobs from being scheduled;
 * jobs already in flight run to completion and unstarted jobs are reported as failed
 * with error class {@code CANCELLED}.
 */
public final class FetchBatch {

    private static final Logger log = LoggerFactory.getLogger(FetchBatch.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final int totalJobs;
    private volatile Mono<FetchSummary> summary;

    FetchBatch(int totalJobs) {
        this.totalJobs = totalJobs;
    }

    void start(Mono<FetchSummary> pipeline) {
        this.summary = pipeline.cache();
        // Runs eagerly; await() and summary() replay the cached outcome
        summary.subscribe(
            result -> log.debug("Fetch batch of {} job(s) completed", totalJobs),
            error -> log.error("Fetch batch of {} job(s) aborted: {}", totalJobs, error.getMessage(), error));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int totalJobs() {
        return totalJobs;
    }

    /**
     * Completes with the batch summary once every job has finished or been accounted for.
     */
    public Mono<FetchSummary> summary() {
        return summary;
    }

    /**
     * Blocks until the batch is done.
     */
    public FetchSummary await() {
        return summary.block();
    }
}
