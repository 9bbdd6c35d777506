package net.proxymachine.model.fetch;

/**
 * Pre-flight view of a batch: how many jobs would download and roughly how many bytes.
 */
public record FetchEstimate(int totalJobs, int alreadyPresent, int toDownload, long estimatedBytes) {
}
