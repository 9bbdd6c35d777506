package net.proxymachine.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of derived-card links recorded in a print's {@code all_parts}.
 */
public enum RelationshipKind {
    /** Sibling faces or parts of double-faced, split and adventure cards. */
    COMBO_PIECE("combo_piece"),
    /** The other half of a meld pair. */
    MELD_PART("meld_part"),
    /** The melded back face produced by a meld pair. */
    MELD_RESULT("meld_result"),
    /** A token the source card creates. */
    TOKEN("token");

    private final String component;

    RelationshipKind(String component) {
        this.component = component;
    }

    /**
     * Component name as stored in the catalog and the index.
     */
    public String component() {
        return component;
    }

    public static Optional<RelationshipKind> fromComponent(String component) {
        if (component == null) {
            return Optional.empty();
        }
        String normalized = component.trim().toLowerCase(Locale.ROOT);
        for (RelationshipKind kind : values()) {
            if (kind.component.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
