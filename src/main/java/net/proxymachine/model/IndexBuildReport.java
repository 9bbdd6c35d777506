package net.proxymachine.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result of a completed index rebuild.
 *
 * @param source          catalog dump the index was built from
 * @param dumpFormat      layout detected for the dump
 * @param printsWritten   distinct prints in the new index
 * @param edgesWritten    relationship edges in the new index
 * @param recordsSkipped  records without an id or name, plus malformed lines
 * @param ftsEnabled      whether the full-text index was built
 * @param elapsed         wall-clock build time, swap included
 */
public record IndexBuildReport(Path source,
                               String dumpFormat,
                               long printsWritten,
                               long edgesWritten,
                               long recordsSkipped,
                               boolean ftsEnabled,
                               Duration elapsed) {
}
