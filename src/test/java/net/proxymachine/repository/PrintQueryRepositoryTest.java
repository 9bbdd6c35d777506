package net.proxymachine.repository;

import net.proxymachine.exception.DatabaseUnavailableException;
import net.proxymachine.model.CardQuery;
import net.proxymachine.model.MatchTier;
import net.proxymachine.model.MeldGroup;
import net.proxymachine.model.Print;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.model.RelationshipKind;
import net.proxymachine.testutil.CardIndexFixture;
import net.proxymachine.testutil.CatalogRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrintQueryRepositoryTest {

    @TempDir
    Path tempDir;

    private CardIndexFixture fixture;
    private PrintQueryRepository repository;

    @BeforeEach
    void setUp() {
        CatalogRecords undated = CatalogRecords.card("u1", "Undated Oddity").set("aaa", "1");
        undated.node().remove("released_at");

        fixture = CardIndexFixture.build(tempDir.resolve("index"), List.of(
            CatalogRecords.card("b10", "Lightning Bolt").set("bbb", "10").releasedAt("2021-01-01")
                .oracleText("Lightning Bolt deals 3 damage to any target.").colorIdentity("R").artist("Christopher Rush"),
            CatalogRecords.card("b2", "Lightning Bolt").set("bbb", "2").releasedAt("2021-01-01")
                .colorIdentity("R").lang("ja"),
            CatalogRecords.card("z1", "Lightning Helix").set("zzz", "1").releasedAt("2020-05-05")
                .colorIdentity("R", "W").rarity("uncommon"),
            undated,
            CatalogRecords.card("f1", "Fire // Ice").set("apc", "128").releasedAt("2001-06-04").colorIdentity("R", "U"),
            CatalogRecords.card("w1", "Wastes").set("ogw", "183").releasedAt("2016-01-22")
                .typeLine("Basic Land — Wastes").producedMana("C"),
            CatalogRecords.token("t1", "Goblin", "Token Creature — Goblin").set("tm19", "2").colorIdentity("R"),
            CatalogRecords.card("m1", "Bruna, the Fading Light").part("m3", "meld_result", "Brisela, Voice of Nightmares")
                .part("m2", "meld_part", "Gisela, the Broken Blade"),
            CatalogRecords.card("m2", "Gisela, the Broken Blade").part("m3", "meld_result", "Brisela, Voice of Nightmares")
                .part("m1", "meld_part", "Bruna, the Fading Light"),
            CatalogRecords.card("m3", "Brisela, Voice of Nightmares")));
        repository = fixture.repository();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void query_ordersByReleaseSetAndNumericCollectorNumber() {
        List<Print> rows = repository.query(CardQuery.builder().nameContains("lightning").build().normalized());

        assertThat(rows).extracting(Print::getId).containsExactly("z1", "b2", "b10");
    }

    @Test
    void query_placesUndatedPrintsLast() {
        List<Print> rows = repository.query(CardQuery.builder().build().normalized());

        assertThat(rows.get(rows.size() - 1).getId()).isEqualTo("u1");
        assertThat(rows).hasSize(10);
    }

    @Test
    void query_isDeterministicAcrossCalls() {
        CardQuery query = CardQuery.builder().text("light").build().normalized();

        assertThat(repository.query(query)).isEqualTo(repository.query(query));
    }

    @Test
    void query_fallsBackToSubstringScanWhenFullTextFindsNothing() {
        List<Print> rows = repository.query(CardQuery.builder().nameContains("ghtning bo").build().normalized());

        assertThat(rows).extracting(Print::getId).containsExactly("b2", "b10");
    }

    @Test
    void query_matchesFreeTextAcrossOracleText() {
        List<Print> rows = repository.query(CardQuery.builder().text("any target").build().normalized());

        assertThat(rows).extracting(Print::getId).containsExactly("b10");
    }

    @Test
    void query_filtersByColorIdentitySubset() {
        List<Print> redOnly = repository.query(CardQuery.builder()
            .colorIdentityWithin(List.of("r")).token(false).build().normalized());
        List<Print> colorless = repository.query(CardQuery.builder()
            .colorIdentityWithin(List.of()).build().normalized());

        assertThat(redOnly).extracting(Print::getId)
            .contains("b2", "b10", "w1")
            .doesNotContain("z1", "f1", "t1");
        assertThat(colorless).extracting(Print::getId).contains("w1", "u1", "m3").doesNotContain("b2", "z1");
    }

    @Test
    void query_appliesFlagLangSetRarityAndLimitFilters() {
        assertThat(repository.query(CardQuery.builder().token(true).build().normalized()))
            .extracting(Print::getId).containsExactly("t1");
        assertThat(repository.query(CardQuery.builder().basicLand(true).build().normalized()))
            .extracting(Print::getId).containsExactly("w1");
        assertThat(repository.query(CardQuery.builder().langs(List.of("JA")).build().normalized()))
            .extracting(Print::getId).containsExactly("b2");
        assertThat(repository.query(CardQuery.builder().setCode("BBB").build().normalized()))
            .extracting(Print::getId).containsExactly("b2", "b10");
        assertThat(repository.query(CardQuery.builder().rarity("Uncommon").build().normalized()))
            .extracting(Print::getId).containsExactly("z1");
        assertThat(repository.query(CardQuery.builder().artistContains("rush").build().normalized()))
            .extracting(Print::getId).containsExactly("b10");
        assertThat(repository.query(CardQuery.builder().limit(2).build().normalized())).hasSize(2);
        assertThat(repository.query(CardQuery.builder().limit(0).build().normalized())).isEmpty();
    }

    @Test
    void query_treatsLikeWildcardsLiterally() {
        assertThat(repository.query(CardQuery.builder().nameContains("%").build().normalized())).isEmpty();
        assertThat(repository.query(CardQuery.builder().nameContains("_").build().normalized())).isEmpty();
    }

    @Test
    void ftsExpression_quotesPrefixTerms() {
        CardQuery query = CardQuery.builder().nameContains("goblin").text("deals 3").build().normalized();

        assertThat(PrintQueryRepository.ftsExpression(query))
            .contains("name : \"goblin\"* AND \"deals\"* AND \"3\"*");
        assertThat(PrintQueryRepository.ftsExpression(CardQuery.builder().nameContains("!!").build())).isEmpty();
    }

    @Test
    void findByIds_returnsRequestOrderAndSkipsUnknownIds() {
        Map<String, Print> found = repository.findByIds(List.of("z1", "missing", "b2", "z1"));

        assertThat(found.keySet()).containsExactly("z1", "b2");
    }

    @Test
    void findNameCandidates_matchesFacesAtExactTier() {
        assertThat(repository.findNameCandidates("Fire", MatchTier.EXACT))
            .extracting(Print::getId).containsExactly("f1");
        assertThat(repository.findNameCandidates("fire // ice", MatchTier.EXACT))
            .extracting(Print::getId).containsExactly("f1");
        assertThat(repository.findNameCandidates("Lightning", MatchTier.EXACT)).isEmpty();
        assertThat(repository.findNameCandidates("Lightning", MatchTier.PREFIX))
            .extracting(Print::getId).containsExactly("z1", "b2", "b10");
        assertThat(repository.findNameCandidates("Fading", MatchTier.CONTAINS))
            .extracting(Print::getId).containsExactly("m1");
        assertThat(repository.findNameCandidates("  ", MatchTier.CONTAINS)).isEmpty();
    }

    @Test
    void findByExactName_filtersByLanguageAndIgnoresFaces() {
        assertThat(repository.findByExactName("lightning bolt", null))
            .extracting(Print::getId).containsExactly("b2", "b10");
        assertThat(repository.findByExactName("Lightning Bolt", " JA "))
            .extracting(Print::getId).containsExactly("b2");
        assertThat(repository.findByExactName("Fire", "en")).isEmpty();
        assertThat(repository.findByExactName("", "en")).isEmpty();
    }

    @Test
    void findRelationshipsAndMeldGroups_reflectStoredEdges() {
        List<RelationshipEdge> edges = repository.findRelationships(List.of("m1"));

        assertThat(edges).extracting(RelationshipEdge::kind)
            .containsExactlyInAnyOrder(RelationshipKind.MELD_PART, RelationshipKind.MELD_RESULT);
        assertThat(repository.findMeldGroups())
            .containsExactly(new MeldGroup("m3", List.of("m1", "m2")));
    }

    @Test
    void read_failsWhenIndexFileMissing() {
        CardIndexHandle missing = new CardIndexHandle(tempDir.resolve("nowhere.db"), 1);
        PrintQueryRepository unavailable = new PrintQueryRepository(missing, CatalogRecords.MAPPER);

        assertThatThrownBy(() -> unavailable.findById("b2"))
            .isInstanceOf(DatabaseUnavailableException.class)
            .hasMessageContaining("not found")
            .hasMessageContaining(DatabaseUnavailableException.REBUILD_HINT);
        assertThat(missing.isAvailable()).isFalse();
    }

    @Test
    void read_failsOnSchemaVersionMismatch() {
        Path stale = tempDir.resolve("stale.db");
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + stale, true);
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        CardIndexSchema.TABLES.forEach(jdbc::execute);
        jdbc.update("INSERT INTO metadata (key, value) VALUES (?, ?)", CardIndexSchema.META_SCHEMA_VERSION, "1");
        dataSource.destroy();

        try (CardIndexHandle handle = new CardIndexHandle(stale, 1)) {
            assertThatThrownBy(() -> new PrintQueryRepository(handle, CatalogRecords.MAPPER).status())
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasMessageContaining("schema version 1");
        }
    }
}
