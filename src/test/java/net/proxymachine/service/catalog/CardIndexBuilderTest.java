package net.proxymachine.service.catalog;

import net.proxymachine.exception.CatalogIngestException;
import net.proxymachine.model.IndexBuildReport;
import net.proxymachine.model.IndexStatus;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.testutil.CardIndexFixture;
import net.proxymachine.testutil.CatalogRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardIndexBuilderTest {

    @TempDir
    Path tempDir;

    private CardIndexFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void rebuild_writesPrintsEdgesAndMetadata() {
        CatalogRecords nameless = CatalogRecords.card("x1", "placeholder");
        nameless.node().remove("name");

        fixture = CardIndexFixture.empty(tempDir);
        IndexBuildReport report = fixture.rebuild(List.of(
            CatalogRecords.card("g1", "Goblin Instigator").part("t1", "token", "Goblin"),
            CatalogRecords.token("t1", "Goblin", "Token Creature — Goblin"),
            CatalogRecords.card("b1", "Lightning Bolt"),
            nameless));

        assertThat(report.printsWritten()).isEqualTo(3);
        assertThat(report.edgesWritten()).isEqualTo(1);
        assertThat(report.recordsSkipped()).isEqualTo(1);
        assertThat(report.dumpFormat()).isEqualTo("LINE_DELIMITED");

        IndexStatus status = fixture.service().status();
        assertThat(status.available()).isTrue();
        assertThat(status.printCount()).isEqualTo(3);
        assertThat(status.edgeCount()).isEqualTo(1);
        assertThat(status.edgesByKind()).containsEntry("token", 1L);
        assertThat(status.schemaVersion()).isEqualTo("7");
        assertThat(status.builtAt()).isNotBlank();
        assertThat(status.ftsEnabled()).isEqualTo(report.ftsEnabled());
        assertThat(fixture.builder().isRebuildRunning()).isFalse();
        assertThat(fixture.handle().stagingPath()).doesNotExist();
    }

    @Test
    void rebuild_repeatedPrintIdReplacesRowAndEdges() {
        // Batch size is two, so the repeat lands in a later transaction
        fixture = CardIndexFixture.build(tempDir, List.of(
            CatalogRecords.card("p1", "Old Name").part("p2", "combo_piece", "Partner"),
            CatalogRecords.card("p2", "Partner"),
            CatalogRecords.card("p3", "Other Partner"),
            CatalogRecords.card("p1", "New Name").part("p3", "combo_piece", "Other Partner")));

        assertThat(fixture.repository().findById("p1")).hasValueSatisfying(print ->
            assertThat(print.getName()).isEqualTo("New Name"));
        assertThat(fixture.repository().findRelationships(List.of("p1")))
            .extracting(RelationshipEdge::relatedPrintId)
            .containsExactly("p3");
    }

    @Test
    void rebuild_swapsNewGenerationIntoPlace() {
        fixture = CardIndexFixture.build(tempDir, List.of(CatalogRecords.card("a1", "Alpha")));
        assertThat(fixture.repository().findById("a1")).isPresent();

        fixture.rebuild(List.of(CatalogRecords.card("b1", "Beta")));

        assertThat(fixture.repository().findById("a1")).isEmpty();
        assertThat(fixture.repository().findById("b1")).isPresent();
    }

    @Test
    void rebuild_failureKeepsPreviousIndex() {
        fixture = CardIndexFixture.build(tempDir, List.of(CatalogRecords.card("a1", "Alpha")));
        Path broken = fixture.writeDump("broken.json", "[{\"id\": \"z\", \"name\": ");

        assertThatThrownBy(() -> fixture.service().rebuild(broken))
            .isInstanceOf(CatalogIngestException.class);

        assertThat(fixture.repository().findById("a1")).isPresent();
        assertThat(Files.exists(fixture.handle().stagingPath())).isFalse();
        assertThat(fixture.builder().isRebuildRunning()).isFalse();
    }
}
