package net.proxymachine.model.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable aggregate of a batch. {@code successful + failed + skipped == totalRequested}
 * holds for every summary built by {@link #aggregate}.
 */
public record FetchSummary(int totalRequested,
                           int successful,
                           int failed,
                           int skipped,
                           long totalBytes,
                           Duration elapsed,
                           List<FetchResult> failedResults) {

    public FetchSummary {
        failedResults = List.copyOf(failedResults);
    }

    /**
     * Builds a summary from per-job results. Only counts and sums are used, so the result
     * does not depend on the order in which jobs completed; failed results are sorted by
     * destination for stable reporting.
     */
    public static FetchSummary aggregate(List<FetchResult> results, Duration elapsed) {
        int successful = 0;
        int failed = 0;
        int skipped = 0;
        long totalBytes = 0L;
        List<FetchResult> failures = new ArrayList<>();
        for (FetchResult result : results) {
            switch (result.status()) {
                case SUCCESS -> {
                    successful++;
                    totalBytes += result.bytes();
                }
                case FAILED -> {
                    failed++;
                    failures.add(result);
                }
                case SKIPPED -> skipped++;
            }
        }
        failures.sort(Comparator.comparing(r -> r.job().destinationPath().toString()));
        return new FetchSummary(results.size(), successful, failed, skipped, totalBytes, elapsed, failures);
    }

    public static FetchSummary empty() {
        return new FetchSummary(0, 0, 0, 0, 0L, Duration.ZERO, List.of());
    }

    /**
     * Jobs that failed, in a form that can be submitted again.
     */
    public List<FetchJob> failedJobs() {
        return failedResults.stream().map(FetchResult::job).toList();
    }

    /**
     * Share of attempted (non-skipped) jobs that succeeded, as a percentage.
     */
    public double successRate() {
        int attempted = successful + failed;
        return attempted == 0 ? 100.0 : successful * 100.0 / attempted;
    }
}
