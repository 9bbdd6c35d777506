package net.proxymachine.model.fetch;

import java.nio.file.Path;

/**
 * One image to download: where it comes from and where it must end up.
 *
 * @param printId         print the image belongs to
 * @param displayName     human-readable label for logs and reports
 * @param sourceUri       remote image location, validated only when the job runs
 * @param destinationPath final file location, unique within a batch
 */
public record FetchJob(String printId, String displayName, String sourceUri, Path destinationPath) {
}
