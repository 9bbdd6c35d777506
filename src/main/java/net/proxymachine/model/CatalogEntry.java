package net.proxymachine.model;

import java.util.List;

/**
 * A normalized catalog record: the print and the edges its payload declares.
 */
public record CatalogEntry(Print print, List<RelationshipEdge> edges) {
    public CatalogEntry {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
