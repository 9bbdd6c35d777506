package net.proxymachine.repository;

import net.proxymachine.model.CardQuery;
import net.proxymachine.model.IndexStatus;
import net.proxymachine.model.MatchTier;
import net.proxymachine.model.MeldGroup;
import net.proxymachine.model.NamePreference;
import net.proxymachine.model.Print;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.model.RelationshipKind;
import net.proxymachine.util.SlugGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-side SQL for the card index. Every method runs inside {@link CardIndexHandle#read}
 * so it observes exactly one index generation.
 */
@Repository
public class PrintQueryRepository {

    private static final Logger log = LoggerFactory.getLogger(PrintQueryRepository.class);

    private static final int ID_CHUNK_SIZE = 500;
    private static final int NAME_CANDIDATE_LIMIT = 1000;
    private static final Pattern FTS_TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    /** Release date, set, numeric collector number, raw collector number, id: a total order. */
    static final String DETERMINISTIC_ORDER =
        " ORDER BY p.released_at IS NULL, p.released_at, p.set_code,"
            + " CAST(p.collector_number AS INTEGER), p.collector_number, p.id";

    private final CardIndexHandle handle;
    private final PrintRowMapper rowMapper;

    public PrintQueryRepository(CardIndexHandle handle, ObjectMapper objectMapper) {
        this.handle = handle;
        this.rowMapper = new PrintRowMapper(objectMapper);
    }

    /**
     * Number of index swaps so far; see {@link CardIndexHandle#generationNumber()}.
     */
    public long indexGeneration() {
        return handle.generationNumber();
    }

    // ── Filtered queries ──

    /**
     * Runs a normalized filter. Free-text and name-substring filters are first narrowed
     * through the full-text index; when that yields nothing the plain substring scan runs.
     */
    public List<Print> query(CardQuery query) {
        return handle.read(session -> {
            if (session.ftsEnabled()) {
                Optional<String> match = ftsExpression(query);
                if (match.isPresent()) {
                    List<Print> ftsRows = runQuery(session.jdbc(), query, match.get());
                    if (!ftsRows.isEmpty()) {
                        return ftsRows;
                    }
                    log.debug("Full-text match '{}' returned no rows, falling back to substring scan", match.get());
                }
            }
            return runQuery(session.jdbc(), query, null);
        });
    }

    private List<Print> runQuery(JdbcTemplate jdbc, CardQuery query, String ftsMatch) {
        if (query.getLimit() != null && query.getLimit() == 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT p.* FROM prints p");
        List<Object> args = new ArrayList<>();
        List<String> where = new ArrayList<>();

        if (ftsMatch != null) {
            sql.append(" JOIN prints_fts ON prints_fts.rowid = p.rowid");
            where.add("prints_fts MATCH ?");
            args.add(ftsMatch);
        }
        if (query.getNameEquals() != null) {
            where.add("p.name_slug = ?");
            args.add(SlugGenerator.slugify(query.getNameEquals()));
        }
        if (query.getNameContains() != null) {
            where.add("p.name LIKE ? ESCAPE '\\'");
            args.add(containsPattern(query.getNameContains()));
        }
        if (query.getText() != null) {
            where.add("(p.name LIKE ? ESCAPE '\\' OR p.oracle_text LIKE ? ESCAPE '\\' OR p.type_line LIKE ? ESCAPE '\\')");
            String pattern = containsPattern(query.getText());
            args.add(pattern);
            args.add(pattern);
            args.add(pattern);
        }
        if (query.getSetCode() != null) {
            where.add("p.set_code = ?");
            args.add(query.getSetCode());
        }
        if (query.getLangs() != null) {
            where.add("p.lang IN (" + placeholders(query.getLangs().size()) + ")");
            args.addAll(query.getLangs());
        }
        if (query.getRarity() != null) {
            where.add("p.rarity = ?");
            args.add(query.getRarity());
        }
        if (query.getLayout() != null) {
            where.add("p.layout = ?");
            args.add(query.getLayout());
        }
        if (query.getTypeLineContains() != null) {
            where.add("p.type_line LIKE ? ESCAPE '\\'");
            args.add(containsPattern(query.getTypeLineContains()));
        }
        if (query.getArtistContains() != null) {
            where.add("p.artist LIKE ? ESCAPE '\\'");
            args.add(containsPattern(query.getArtistContains()));
        }
        if (query.getColorIdentityWithin() != null) {
            if (query.getColorIdentityWithin().isEmpty()) {
                where.add("NOT EXISTS (SELECT 1 FROM json_each(p.color_identity))");
            } else {
                where.add("NOT EXISTS (SELECT 1 FROM json_each(p.color_identity) je WHERE je.value NOT IN ("
                    + placeholders(query.getColorIdentityWithin().size()) + "))");
                args.addAll(query.getColorIdentityWithin());
            }
        }
        if (query.getToken() != null) {
            where.add("p.is_token = ?");
            args.add(query.getToken() ? 1 : 0);
        }
        if (query.getBasicLand() != null) {
            where.add("p.is_basic_land = ?");
            args.add(query.getBasicLand() ? 1 : 0);
        }
        if (query.isFullArtOnly()) {
            where.add("p.full_art = 1");
        }

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        sql.append(DETERMINISTIC_ORDER);
        if (query.getLimit() != null) {
            sql.append(" LIMIT ?");
            args.add(query.getLimit());
        }
        return jdbc.query(sql.toString(), rowMapper, args.toArray());
    }

    /**
     * FTS5 expression for the free-text parts of a filter: every token becomes a quoted
     * prefix term, name tokens restricted to the name column. Empty when the filter has
     * no usable free-text tokens.
     */
    static Optional<String> ftsExpression(CardQuery query) {
        List<String> terms = new ArrayList<>();
        for (String token : tokens(query.getNameContains())) {
            terms.add("name : \"" + token + "\"*");
        }
        for (String token : tokens(query.getText())) {
            terms.add("\"" + token + "\"*");
        }
        return terms.isEmpty() ? Optional.empty() : Optional.of(String.join(" AND ", terms));
    }

    private static List<String> tokens(String value) {
        if (value == null) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = FTS_TOKEN.matcher(value.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static String containsPattern(String value) {
        String escaped = value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    // ── Lookups ──

    public Optional<Print> findById(String printId) {
        return handle.read(session -> session.jdbc()
            .query("SELECT p.* FROM prints p WHERE p.id = ?", rowMapper, printId)
            .stream()
            .findFirst());
    }

    /**
     * Prints for the given ids, keyed by id in request order; unknown ids are absent.
     */
    public Map<String, Print> findByIds(Collection<String> printIds) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(printIds));
        if (ids.isEmpty()) {
            return Map.of();
        }
        return handle.read(session -> {
            Map<String, Print> found = new LinkedHashMap<>();
            for (int start = 0; start < ids.size(); start += ID_CHUNK_SIZE) {
                List<String> chunk = ids.subList(start, Math.min(start + ID_CHUNK_SIZE, ids.size()));
                session.jdbc()
                    .query("SELECT p.* FROM prints p WHERE p.id IN (" + placeholders(chunk.size()) + ")",
                        rowMapper, chunk.toArray())
                    .forEach(print -> found.put(print.getId(), print));
            }
            Map<String, Print> ordered = new LinkedHashMap<>();
            for (String id : ids) {
                Print print = found.get(id);
                if (print != null) {
                    ordered.put(id, print);
                }
            }
            return ordered;
        });
    }

    /**
     * Prints whose name matches the requested name at the given tier, in index order.
     * EXACT also matches a single face of a multi-face name ("Fire" matches "Fire // Ice").
     */
    public List<Print> findNameCandidates(String requestedName, MatchTier tier) {
        return findNameCandidates(requestedName, tier, null);
    }

    /**
     * Like {@link #findNameCandidates(String, MatchTier)}, but ordered best first for the
     * given preference before the candidate cap applies, so heavily reprinted names never
     * lose their preferred or newest print to the cap.
     */
    public List<Print> findNameCandidates(String requestedName, MatchTier tier, NamePreference preference) {
        String slug = SlugGenerator.slugify(requestedName);
        if (slug.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>();
        String where;
        switch (tier) {
            case EXACT -> {
                where = "p.name_slug = ? OR (p.name LIKE '% // %' AND instr(' // ' || lower(p.name) || ' // ', ?) > 0)";
                args.add(slug);
                args.add(" // " + requestedName.trim().toLowerCase(Locale.ROOT) + " // ");
            }
            case PREFIX -> {
                where = "p.name_slug LIKE ?";
                args.add(slug + "%");
            }
            default -> {
                where = "p.name_slug LIKE ?";
                args.add("%" + slug + "%");
            }
        }
        String order = preference == null ? DETERMINISTIC_ORDER : preferenceOrder(preference, args);
        String sql = "SELECT p.* FROM prints p WHERE (" + where + ")" + order + " LIMIT " + NAME_CANDIDATE_LIMIT;
        return handle.read(session -> session.jdbc().query(sql, rowMapper, args.toArray()));
    }

    /** Set, collector number, language, token-ness, newest release, id. */
    private static String preferenceOrder(NamePreference preference, List<Object> args) {
        args.add(preference.setCode());
        args.add(preference.collectorNumber());
        args.add(preference.lang());
        args.add(preference.token() ? 1 : 0);
        return " ORDER BY COALESCE(lower(p.set_code) = lower(?), 0) DESC,"
            + " COALESCE(lower(p.collector_number) = lower(?), 0) DESC,"
            + " COALESCE(lower(p.lang) = lower(?), 0) DESC,"
            + " p.is_token <> ?,"
            + " p.released_at IS NULL, p.released_at DESC, p.id";
    }

    /**
     * Prints whose name slug equals the given name, optionally restricted to one language.
     * Unlike {@link #findNameCandidates}, single faces do not match.
     */
    public List<Print> findByExactName(String name, String lang) {
        String slug = SlugGenerator.slugify(name);
        if (slug.isEmpty()) {
            return List.of();
        }
        if (!StringUtils.hasText(lang)) {
            return handle.read(session -> session.jdbc()
                .query("SELECT p.* FROM prints p WHERE p.name_slug = ?" + DETERMINISTIC_ORDER, rowMapper, slug));
        }
        String normalizedLang = lang.trim().toLowerCase(Locale.ROOT);
        return handle.read(session -> session.jdbc()
            .query("SELECT p.* FROM prints p WHERE p.name_slug = ? AND p.lang = ?" + DETERMINISTIC_ORDER,
                rowMapper, slug, normalizedLang));
    }

    // ── Relationships ──

    /**
     * Edges leaving the given prints, ordered by source, kind, related name and related id.
     */
    public List<RelationshipEdge> findRelationships(Collection<String> sourcePrintIds) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(sourcePrintIds));
        if (ids.isEmpty()) {
            return List.of();
        }
        return handle.read(session -> {
            List<RelationshipEdge> edges = new ArrayList<>();
            for (int start = 0; start < ids.size(); start += ID_CHUNK_SIZE) {
                List<String> chunk = ids.subList(start, Math.min(start + ID_CHUNK_SIZE, ids.size()));
                edges.addAll(session.jdbc().query(
                    "SELECT source_print_id, related_print_id, relationship_kind, related_card_name"
                        + " FROM card_relationships WHERE source_print_id IN (" + placeholders(chunk.size()) + ")"
                        + " ORDER BY source_print_id, relationship_kind, related_card_name, related_print_id",
                    (rs, rowNum) -> new RelationshipEdge(
                        rs.getString("source_print_id"),
                        rs.getString("related_print_id"),
                        RelationshipKind.fromComponent(rs.getString("relationship_kind")).orElse(null),
                        rs.getString("related_card_name")),
                    chunk.toArray()));
            }
            return edges.stream().filter(edge -> edge.kind() != null).toList();
        });
    }

    /**
     * Every meld result with the parts that point at it.
     */
    public List<MeldGroup> findMeldGroups() {
        return handle.read(session -> {
            Map<String, List<String>> parts = new LinkedHashMap<>();
            session.jdbc().query(
                "SELECT related_print_id, source_print_id FROM card_relationships"
                    + " WHERE relationship_kind = ? AND source_print_id <> related_print_id"
                    + " ORDER BY related_print_id, source_print_id",
                rs -> {
                    parts.computeIfAbsent(rs.getString("related_print_id"), key -> new ArrayList<>())
                        .add(rs.getString("source_print_id"));
                },
                RelationshipKind.MELD_RESULT.component());
            return parts.entrySet().stream()
                .map(entry -> new MeldGroup(entry.getKey(), entry.getValue()))
                .toList();
        });
    }

    // ── Status ──

    public IndexStatus status() {
        return handle.read(session -> {
            JdbcTemplate jdbc = session.jdbc();
            Map<String, String> metadata = new LinkedHashMap<>();
            jdbc.query("SELECT key, value FROM metadata", rs -> {
                metadata.put(rs.getString("key"), rs.getString("value"));
            });
            Long prints = jdbc.queryForObject("SELECT COUNT(*) FROM prints", Long.class);
            Map<String, Long> byKind = new LinkedHashMap<>();
            jdbc.query("SELECT relationship_kind, COUNT(*) AS edge_count FROM card_relationships"
                    + " GROUP BY relationship_kind ORDER BY relationship_kind",
                rs -> {
                    byKind.put(rs.getString("relationship_kind"), rs.getLong("edge_count"));
                });
            long edges = byKind.values().stream().mapToLong(Long::longValue).sum();
            return new IndexStatus(true,
                metadata.get(CardIndexSchema.META_SCHEMA_VERSION),
                prints == null ? 0L : prints,
                edges,
                byKind,
                session.ftsEnabled(),
                metadata.get(CardIndexSchema.META_BUILT_AT),
                metadata.get(CardIndexSchema.META_SOURCE),
                null);
        });
    }
}
