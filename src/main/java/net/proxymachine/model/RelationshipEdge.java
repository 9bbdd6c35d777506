package net.proxymachine.model;

/**
 * Directed link from a print to a related print, derived from the source print's
 * own catalog payload. {@code relatedCardName} lets the resolver fall back to a name
 * lookup when the related print id is absent from the index.
 */
public record RelationshipEdge(String sourcePrintId,
                               String relatedPrintId,
                               RelationshipKind kind,
                               String relatedCardName) {
}
