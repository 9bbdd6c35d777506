package net.proxymachine.service.catalog;

import net.proxymachine.exception.CatalogIngestException;
import net.proxymachine.testutil.CatalogRecords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogDumpReaderTest {

    @TempDir
    Path tempDir;

    private final CatalogDumpReader reader = new CatalogDumpReader(CatalogRecords.MAPPER);

    private final List<CatalogRecords> records = List.of(
        CatalogRecords.card("a", "Alpha"),
        CatalogRecords.card("b", "Beta"),
        CatalogRecords.card("c", "Gamma"));

    @Test
    void shouldStreamJsonArrayInFileOrder() throws IOException {
        Path dump = write("cards.json", CatalogRecords.jsonArray(records));
        List<String> ids = new ArrayList<>();

        CatalogDumpReader.ReadSummary summary = reader.read(dump, node -> ids.add(node.path("id").asString()));

        assertThat(summary.format()).isEqualTo(CatalogDumpReader.DumpFormat.JSON_ARRAY);
        assertThat(summary.records()).isEqualTo(3);
        assertThat(ids).containsExactly("a", "b", "c");
    }

    @Test
    void shouldSkipMalformedLinesInLineDelimitedDump() throws IOException {
        String text = "\uFEFF" + records.get(0).json() + "\n"
            + "\n"
            + "{\"id\": \"broken\n"
            + records.get(1).json() + ",\n"
            + "42\n"
            + records.get(2).json() + "\n";
        Path dump = write("cards.ndjson", text);
        List<JsonNode> seen = new ArrayList<>();

        CatalogDumpReader.ReadSummary summary = reader.read(dump, seen::add);

        assertThat(summary.format()).isEqualTo(CatalogDumpReader.DumpFormat.LINE_DELIMITED);
        assertThat(summary.records()).isEqualTo(3);
        assertThat(summary.malformed()).isEqualTo(2);
        assertThat(seen).extracting(node -> node.path("id").asString()).containsExactly("a", "b", "c");
    }

    @Test
    void shouldKeepReadingLinesWhenFirstLineIsBroken() throws IOException {
        String text = "{\"id\": broken\n"
            + records.get(0).json() + "\n"
            + records.get(1).json() + "\n";
        Path dump = write("broken-head.ndjson", text);
        List<String> ids = new ArrayList<>();

        CatalogDumpReader.ReadSummary summary = reader.read(dump, node -> ids.add(node.path("id").asString()));

        assertThat(summary.format()).isEqualTo(CatalogDumpReader.DumpFormat.LINE_DELIMITED);
        assertThat(ids).containsExactly("a", "b");
        assertThat(summary.malformed()).isEqualTo(1);
    }

    @Test
    void shouldReadGzipCompressedDump() throws IOException {
        Path dump = tempDir.resolve("cards.json.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(dump))) {
            out.write(CatalogRecords.ndjson(records).getBytes(StandardCharsets.UTF_8));
        }

        CatalogDumpReader.ReadSummary summary = reader.read(dump, node -> { });

        assertThat(summary.records()).isEqualTo(3);
    }

    @Test
    void shouldUnwrapDataArrayFromPrettyPrintedDocument() throws IOException {
        String text = "{\n  \"object\": \"list\",\n  \"data\": " + CatalogRecords.jsonArray(records) + "}\n";
        Path dump = write("wrapped.json", text);
        List<JsonNode> seen = new ArrayList<>();

        CatalogDumpReader.ReadSummary summary = reader.read(dump, seen::add);

        assertThat(summary.format()).isEqualTo(CatalogDumpReader.DumpFormat.WRAPPED_ARRAY);
        assertThat(seen).hasSize(3);
    }

    @Test
    void shouldUnwrapSingleLineWrapper() throws IOException {
        String text = "{\"cards\": " + CatalogRecords.jsonArray(records).replace("\n", "") + "}";
        Path dump = write("wrapped-line.json", text);

        CatalogDumpReader.ReadSummary summary = reader.read(dump, node -> { });

        assertThat(summary.format()).isEqualTo(CatalogDumpReader.DumpFormat.WRAPPED_ARRAY);
        assertThat(summary.records()).isEqualTo(3);
    }

    @Test
    void shouldRejectMissingEmptyAndUnrecognizedFiles() throws IOException {
        Path missing = tempDir.resolve("missing.json");
        Path empty = write("empty.json", "  \n");
        Path csv = write("cards.csv", "id,name\na,Alpha\n");

        assertThatThrownBy(() -> reader.read(missing, node -> { }))
            .isInstanceOf(CatalogIngestException.class)
            .hasMessageContaining("missing");
        assertThatThrownBy(() -> reader.read(empty, node -> { }))
            .isInstanceOf(CatalogIngestException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> reader.read(csv, node -> { }))
            .isInstanceOf(CatalogIngestException.class)
            .hasMessageContaining("unrecognized layout");
    }

    @Test
    void shouldRejectTruncatedArray() throws IOException {
        String text = CatalogRecords.jsonArray(records);
        Path dump = write("truncated.json", text.substring(0, text.length() / 2));

        assertThatThrownBy(() -> reader.read(dump, node -> { }))
            .isInstanceOf(CatalogIngestException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}
