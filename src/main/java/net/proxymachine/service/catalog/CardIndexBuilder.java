package net.proxymachine.service.catalog;

import net.proxymachine.config.CardIndexProperties;
import net.proxymachine.mapper.CatalogRecordMapper;
import net.proxymachine.model.CatalogEntry;
import net.proxymachine.model.IndexBuildReport;
import net.proxymachine.model.Print;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.repository.CardIndexHandle;
import net.proxymachine.repository.CardIndexSchema;
import net.proxymachine.repository.PrintRowMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a new card index generation from a catalog dump and swaps it in.
 * <p>
 * The build writes into a staging file with bounded, transactional batches; the live
 * index keeps serving readers until {@link CardIndexHandle#replaceWith} swaps the finished
 * file in. Only one rebuild may run at a time.
 */
@Service
public class CardIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(CardIndexBuilder.class);

    private static final String UPSERT_PRINT = """
        INSERT OR REPLACE INTO prints (
            id, oracle_id, name, name_slug, set_code, set_name, collector_number, lang, released_at,
            type_line, layout, rarity, oracle_text, power, toughness,
            colors, color_identity, produced_mana, keywords, artist,
            image_url, frame, frame_effects, border_color, illustration_id,
            is_token, is_basic_land, full_art, textless, promo
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String DELETE_EDGES_FOR_SOURCE = "DELETE FROM card_relationships WHERE source_print_id = ?";

    private static final String INSERT_EDGE = """
        INSERT OR IGNORE INTO card_relationships (source_print_id, related_print_id, relationship_kind, related_card_name)
        VALUES (?, ?, ?, ?)
        """;

    private final CardIndexHandle handle;
    private final CatalogDumpReader dumpReader;
    private final CatalogRecordMapper recordMapper;
    private final PrintRowMapper rowMapper;
    private final int batchSize;
    private final AtomicBoolean rebuildRunning = new AtomicBoolean(false);

    public CardIndexBuilder(CardIndexHandle handle,
                            CatalogDumpReader dumpReader,
                            CatalogRecordMapper recordMapper,
                            ObjectMapper objectMapper,
                            CardIndexProperties properties) {
        this.handle = handle;
        this.dumpReader = dumpReader;
        this.recordMapper = recordMapper;
        this.rowMapper = new PrintRowMapper(objectMapper);
        this.batchSize = properties.getBatchSize();
    }

    public boolean isRebuildRunning() {
        return rebuildRunning.get();
    }

    /**
     * Ingests the dump into a fresh generation and swaps it in.
     *
     * @throws IllegalStateException when another rebuild is already running
     * @throws net.proxymachine.exception.CatalogIngestException when the dump cannot be read
     */
    public IndexBuildReport rebuild(Path dump) {
        if (!rebuildRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("Card index rebuild already running");
        }
        Instant started = Instant.now();
        Path staging = handle.stagingPath();
        SingleConnectionDataSource dataSource = null;
        try {
            prepareStagingFile(staging);
            dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + staging, true);
            JdbcTemplate jdbc = new JdbcTemplate(dataSource);
            TransactionTemplate transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));

            jdbc.execute("PRAGMA journal_mode = MEMORY");
            jdbc.execute("PRAGMA synchronous = OFF");
            createSchema(jdbc);
            boolean ftsEnabled = createFullTextTable(jdbc);

            IngestCounters counters = new IngestCounters();
            List<CatalogEntry> batch = new ArrayList<>(batchSize);
            CatalogDumpReader.ReadSummary summary = dumpReader.read(dump, record -> {
                recordMapper.map(record).ifPresentOrElse(entry -> {
                    batch.add(entry);
                    if (batch.size() >= batchSize) {
                        flush(transactions, jdbc, batch, counters);
                    }
                }, counters.skipped::incrementAndGet);
            });
            flush(transactions, jdbc, batch, counters);

            finalizeIndex(jdbc, ftsEnabled, dump, counters.skipped.get() + summary.malformed());
            long prints = count(jdbc, "SELECT COUNT(*) FROM prints");
            long edges = count(jdbc, "SELECT COUNT(*) FROM card_relationships");

            dataSource.destroy();
            dataSource = null;
            handle.replaceWith(staging);

            Duration elapsed = Duration.between(started, Instant.now());
            log.info("Card index rebuilt from {}: prints={} edges={} skipped={} fts={} elapsedMs={}",
                dump, prints, edges, counters.skipped.get() + summary.malformed(), ftsEnabled, elapsed.toMillis());
            return new IndexBuildReport(dump, summary.format().name(), prints, edges,
                counters.skipped.get() + summary.malformed(), ftsEnabled, elapsed);
        } catch (RuntimeException ex) {
            log.error("Card index rebuild from {} failed: {}", dump, ex.getMessage());
            if (dataSource != null) {
                dataSource.destroy();
            }
            deleteQuietly(staging);
            throw ex;
        } finally {
            rebuildRunning.set(false);
        }
    }

    // ── Schema ──

    private static void createSchema(JdbcTemplate jdbc) {
        CardIndexSchema.TABLES.forEach(jdbc::execute);
    }

    private static boolean createFullTextTable(JdbcTemplate jdbc) {
        try {
            jdbc.execute(CardIndexSchema.CREATE_FTS);
            return true;
        } catch (DataAccessException ex) {
            log.warn("FTS5 unavailable in this SQLite build, free-text queries will use substring scans: {}",
                ex.getMostSpecificCause().getMessage());
            return false;
        }
    }

    // ── Batches ──

    private void flush(TransactionTemplate transactions, JdbcTemplate jdbc, List<CatalogEntry> batch, IngestCounters counters) {
        if (batch.isEmpty()) {
            return;
        }
        List<Print> prints = new ArrayList<>(batch.size());
        Map<String, List<RelationshipEdge>> edgesBySource = new LinkedHashMap<>();
        for (CatalogEntry entry : batch) {
            prints.add(entry.print());
            edgesBySource.put(entry.print().getId(), entry.edges());
        }
        List<RelationshipEdge> edges = edgesBySource.values().stream().flatMap(List::stream).toList();
        List<String> sourceIds = new ArrayList<>(edgesBySource.keySet());

        transactions.executeWithoutResult(status -> {
            jdbc.batchUpdate(UPSERT_PRINT, prints, prints.size(), (ps, print) -> {
                int i = 1;
                ps.setString(i++, print.getId());
                ps.setString(i++, print.getOracleId());
                ps.setString(i++, print.getName());
                ps.setString(i++, print.getNameSlug());
                ps.setString(i++, print.getSetCode());
                ps.setString(i++, print.getSetName());
                ps.setString(i++, print.getCollectorNumber());
                ps.setString(i++, print.getLang());
                ps.setString(i++, print.getReleasedAt());
                ps.setString(i++, print.getTypeLine());
                ps.setString(i++, print.getLayout());
                ps.setString(i++, print.getRarity());
                ps.setString(i++, print.getOracleText());
                ps.setString(i++, print.getPower());
                ps.setString(i++, print.getToughness());
                ps.setString(i++, rowMapper.encodeList(print.getColors()));
                ps.setString(i++, rowMapper.encodeList(print.getColorIdentity()));
                ps.setString(i++, rowMapper.encodeList(print.getProducedMana()));
                ps.setString(i++, rowMapper.encodeList(print.getKeywords()));
                ps.setString(i++, print.getArtist());
                ps.setString(i++, print.getImageUrl());
                ps.setString(i++, print.getFrame());
                ps.setString(i++, rowMapper.encodeList(print.getFrameEffects()));
                ps.setString(i++, print.getBorderColor());
                ps.setString(i++, print.getIllustrationId());
                ps.setInt(i++, print.isToken() ? 1 : 0);
                ps.setInt(i++, print.isBasicLand() ? 1 : 0);
                ps.setInt(i++, print.isFullArt() ? 1 : 0);
                ps.setInt(i++, print.isTextless() ? 1 : 0);
                ps.setInt(i, print.isPromo() ? 1 : 0);
            });
            // A repeated print id replaces its earlier edges along with the row
            jdbc.batchUpdate(DELETE_EDGES_FOR_SOURCE, sourceIds, sourceIds.size(), (ps, id) -> ps.setString(1, id));
            if (!edges.isEmpty()) {
                jdbc.batchUpdate(INSERT_EDGE, edges, edges.size(), (ps, edge) -> {
                    ps.setString(1, edge.sourcePrintId());
                    ps.setString(2, edge.relatedPrintId());
                    ps.setString(3, edge.kind().component());
                    ps.setString(4, edge.relatedCardName());
                });
            }
        });
        counters.batches.incrementAndGet();
        counters.records.addAndGet(batch.size());
        log.debug("Committed batch {} ({} records so far)", counters.batches.get(), counters.records.get());
        batch.clear();
    }

    // ── Finalization ──

    private static void finalizeIndex(JdbcTemplate jdbc, boolean ftsEnabled, Path dump, long skipped) {
        // VACUUM may renumber implicit rowids, which the external-content FTS table keys on
        jdbc.execute("VACUUM");
        if (ftsEnabled) {
            jdbc.execute(CardIndexSchema.REBUILD_FTS);
        }
        CardIndexSchema.INDEXES.forEach(jdbc::execute);

        writeMetadata(jdbc, CardIndexSchema.META_SCHEMA_VERSION, String.valueOf(CardIndexSchema.SCHEMA_VERSION));
        writeMetadata(jdbc, CardIndexSchema.META_BUILT_AT, Instant.now().toString());
        writeMetadata(jdbc, CardIndexSchema.META_SOURCE, dump.getFileName().toString());
        writeMetadata(jdbc, CardIndexSchema.META_PRINT_COUNT, String.valueOf(count(jdbc, "SELECT COUNT(*) FROM prints")));
        writeMetadata(jdbc, CardIndexSchema.META_EDGE_COUNT, String.valueOf(count(jdbc, "SELECT COUNT(*) FROM card_relationships")));
        writeMetadata(jdbc, CardIndexSchema.META_SKIPPED_RECORDS, String.valueOf(skipped));

        jdbc.execute("ANALYZE");
        jdbc.execute("PRAGMA journal_mode = DELETE");
    }

    private static void writeMetadata(JdbcTemplate jdbc, String key, String value) {
        jdbc.update("INSERT OR REPLACE INTO metadata (key, value) VALUES (?, ?)", key, value);
    }

    private static long count(JdbcTemplate jdbc, String sql) {
        Long value = jdbc.queryForObject(sql, Long.class);
        return value == null ? 0L : value;
    }

    // ── Staging file ──

    private static void prepareStagingFile(Path staging) {
        try {
            Path parent = staging.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.deleteIfExists(staging);
            Files.deleteIfExists(staging.resolveSibling(staging.getFileName() + "-journal"));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot prepare staging index " + staging, ex);
        }
    }

    private static void deleteQuietly(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException ex) {
            log.warn("Failed to delete staging index {}: {}", staging, ex.getMessage());
        }
    }

    private static final class IngestCounters {
        private final AtomicLong records = new AtomicLong();
        private final AtomicLong skipped = new AtomicLong();
        private final AtomicLong batches = new AtomicLong();
    }
}
