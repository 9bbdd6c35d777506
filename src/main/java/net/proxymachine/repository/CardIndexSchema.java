package net.proxymachine.repository;

import java.util.List;

/**
 * DDL for the card index. Bump {@link #SCHEMA_VERSION} whenever a table or column changes;
 * readers refuse an index built with a different version.
 */
public final class CardIndexSchema {

    public static final int SCHEMA_VERSION = 7;

    public static final String FTS_TABLE = "prints_fts";

    public static final List<String> TABLES = List.of(
        """
        CREATE TABLE IF NOT EXISTS prints (
            id TEXT PRIMARY KEY,
            oracle_id TEXT,
            name TEXT NOT NULL,
            name_slug TEXT NOT NULL,
            set_code TEXT,
            set_name TEXT,
            collector_number TEXT,
            lang TEXT,
            released_at TEXT,
            type_line TEXT,
            layout TEXT,
            rarity TEXT,
            oracle_text TEXT,
            power TEXT,
            toughness TEXT,
            colors TEXT NOT NULL DEFAULT '[]',
            color_identity TEXT NOT NULL DEFAULT '[]',
            produced_mana TEXT NOT NULL DEFAULT '[]',
            keywords TEXT NOT NULL DEFAULT '[]',
            artist TEXT,
            image_url TEXT,
            frame TEXT,
            frame_effects TEXT NOT NULL DEFAULT '[]',
            border_color TEXT,
            illustration_id TEXT,
            is_token INTEGER NOT NULL DEFAULT 0,
            is_basic_land INTEGER NOT NULL DEFAULT 0,
            full_art INTEGER NOT NULL DEFAULT 0,
            textless INTEGER NOT NULL DEFAULT 0,
            promo INTEGER NOT NULL DEFAULT 0
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS card_relationships (
            source_print_id TEXT NOT NULL,
            related_print_id TEXT NOT NULL,
            relationship_kind TEXT NOT NULL,
            related_card_name TEXT,
            PRIMARY KEY (source_print_id, related_print_id, relationship_kind)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS metadata (
            key TEXT PRIMARY KEY,
            value TEXT
        )
        """
    );

    public static final String CREATE_FTS = """
        CREATE VIRTUAL TABLE IF NOT EXISTS prints_fts USING fts5(
            name, oracle_text, type_line,
            content='prints', content_rowid='rowid',
            tokenize='unicode61 remove_diacritics 2'
        )
        """;

    public static final String REBUILD_FTS = "INSERT INTO prints_fts(prints_fts) VALUES('rebuild')";

    public static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_prints_set_lang ON prints(set_code, lang)",
        "CREATE INDEX IF NOT EXISTS idx_prints_name_slug ON prints(name_slug)",
        "CREATE INDEX IF NOT EXISTS idx_prints_token_lang ON prints(is_token, lang)",
        "CREATE INDEX IF NOT EXISTS idx_prints_basic_lang_set ON prints(is_basic_land, lang, set_code)",
        "CREATE INDEX IF NOT EXISTS idx_prints_oracle_lang ON prints(oracle_id, lang)",
        "CREATE INDEX IF NOT EXISTS idx_prints_release_order ON prints(released_at, set_code, collector_number)",
        "CREATE INDEX IF NOT EXISTS idx_relationships_source ON card_relationships(source_print_id, relationship_kind)",
        "CREATE INDEX IF NOT EXISTS idx_relationships_kind ON card_relationships(relationship_kind, related_print_id)"
    );

    // ── Metadata keys ──
    public static final String META_SCHEMA_VERSION = "schema_version";
    public static final String META_BUILT_AT = "built_at";
    public static final String META_SOURCE = "source";
    public static final String META_PRINT_COUNT = "print_count";
    public static final String META_EDGE_COUNT = "edge_count";
    public static final String META_SKIPPED_RECORDS = "skipped_records";

    private CardIndexSchema() {
    }
}
