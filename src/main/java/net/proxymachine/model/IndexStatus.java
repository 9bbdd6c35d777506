package net.proxymachine.model;

import java.util.Map;

/**
 * Health and size of the card index, as reported by verification.
 */
public record IndexStatus(boolean available,
                          String schemaVersion,
                          long printCount,
                          long edgeCount,
                          Map<String, Long> edgesByKind,
                          boolean ftsEnabled,
                          String builtAt,
                          String source,
                          String unavailableReason) {

    public IndexStatus {
        edgesByKind = edgesByKind == null ? Map.of() : Map.copyOf(edgesByKind);
    }

    public static IndexStatus unavailable(String reason) {
        return new IndexStatus(false, null, 0L, 0L, Map.of(), false, null, null, reason);
    }
}
