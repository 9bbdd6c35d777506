package net.proxymachine.service.catalog;

import net.proxymachine.exception.CatalogIngestException;
import net.proxymachine.util.CompressionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Streams records out of a catalog dump without loading the whole file.
 * <p>
 * Compression is sniffed from magic bytes; the layout from the first non-whitespace
 * character: {@code [} is a JSON array, {@code {} is line-delimited objects. A pretty-printed
 * or single-line {@code {"data": [...]}} wrapper is recognized as well.
 */
@Component
public class CatalogDumpReader {

    private static final Logger log = LoggerFactory.getLogger(CatalogDumpReader.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final List<String> WRAPPER_FIELDS = List.of("data", "cards");

    /**
     * Layout detected for a dump.
     */
    public enum DumpFormat {
        JSON_ARRAY,
        LINE_DELIMITED,
        WRAPPED_ARRAY
    }

    /**
     * @param format    detected layout
     * @param records   records handed to the sink
     * @param malformed lines or elements that were not JSON objects and were skipped
     */
    public record ReadSummary(DumpFormat format, long records, long malformed) {
    }

    private final ObjectMapper objectMapper;

    public CatalogDumpReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads every record in the dump and hands it to {@code sink} in file order.
     *
     * @throws CatalogIngestException when the file is missing, unreadable, empty, or in
     *         neither supported layout
     */
    public ReadSummary read(Path dump, Consumer<JsonNode> sink) {
        if (dump == null || !Files.isRegularFile(dump) || !Files.isReadable(dump)) {
            throw new CatalogIngestException(dump, "file is missing or not readable");
        }
        try (BufferedReader reader = openReader(dump)) {
            int first = peekFirstSignificantChar(reader);
            if (first == -1) {
                throw new CatalogIngestException(dump, "file is empty");
            }
            if (first == '[') {
                return readArray(dump, reader, sink, DumpFormat.JSON_ARRAY);
            }
            if (first == '{') {
                return readLines(dump, reader, sink, true);
            }
            throw new CatalogIngestException(dump,
                "unrecognized layout, expected a JSON array or line-delimited objects but found '" + (char) first + "'");
        } catch (IOException ex) {
            throw new CatalogIngestException(dump, "read failed: " + ex.getMessage(), ex);
        }
    }

    private BufferedReader openReader(Path dump) throws IOException {
        return new BufferedReader(new InputStreamReader(CompressionUtils.openDecompressed(dump), StandardCharsets.UTF_8));
    }

    /**
     * Consumes leading whitespace and a byte order mark, leaving the reader positioned at
     * the first significant character, which is returned without being consumed.
     */
    private static int peekFirstSignificantChar(BufferedReader reader) throws IOException {
        while (true) {
            reader.mark(1);
            int c = reader.read();
            if (c == -1) {
                return -1;
            }
            if (c != BYTE_ORDER_MARK && !Character.isWhitespace(c)) {
                reader.reset();
                return c;
            }
        }
    }

    // ── JSON array ──

    private ReadSummary readArray(Path dump, BufferedReader reader, Consumer<JsonNode> sink, DumpFormat format) {
        long records = 0;
        long malformed = 0;
        try (JsonParser parser = objectMapper.createParser(reader)) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new CatalogIngestException(dump, "expected a JSON array");
            }
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new CatalogIngestException(dump, "array is truncated after " + records + " records");
                }
                if (token == JsonToken.START_OBJECT) {
                    JsonNode node = objectMapper.readTree(parser);
                    sink.accept(node);
                    records++;
                } else {
                    parser.skipChildren();
                    malformed++;
                }
            }
        } catch (JacksonException ex) {
            throw new CatalogIngestException(dump, "invalid JSON after " + records + " records: " + ex.getOriginalMessage(), ex);
        }
        log.info("Read {} records from {} ({}, malformed={})", records, dump, format, malformed);
        return new ReadSummary(format, records, malformed);
    }

    // ── Line-delimited ──

    private ReadSummary readLines(Path dump, BufferedReader reader, Consumer<JsonNode> sink,
                                  boolean detectWrapper) throws IOException {
        long records = 0;
        long malformed = 0;
        boolean firstRecordLine = detectWrapper;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = stripRecordNoise(line);
            if (trimmed.isEmpty()) {
                continue;
            }
            JsonNode node = parseLine(trimmed);
            if (firstRecordLine) {
                firstRecordLine = false;
                if (node == null) {
                    // Opening line of a pretty-printed document, or a broken first record
                    reader.close();
                    return readWrapperDocument(dump, sink);
                }
                JsonNode wrapped = wrappedArray(node);
                if (wrapped != null) {
                    return emitWrapped(dump, wrapped, sink);
                }
            }
            if (node != null && node.isObject()) {
                sink.accept(node);
                records++;
            } else {
                malformed++;
            }
        }
        if (malformed > 0) {
            log.warn("Skipped {} malformed lines in {}", malformed, dump);
        }
        log.info("Read {} records from {} ({}, malformed={})", records, dump, DumpFormat.LINE_DELIMITED, malformed);
        return new ReadSummary(DumpFormat.LINE_DELIMITED, records, malformed);
    }

    private static String stripRecordNoise(String line) {
        String trimmed = line.strip();
        if (!trimmed.isEmpty() && trimmed.charAt(0) == BYTE_ORDER_MARK) {
            trimmed = trimmed.substring(1).strip();
        }
        if ("[".equals(trimmed) || "]".equals(trimmed)) {
            return "";
        }
        if (trimmed.endsWith(",")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return trimmed;
    }

    private JsonNode parseLine(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (JacksonException ex) {
            return null;
        }
    }

    // ── Wrapper document ──

    /**
     * Reads the whole file as one wrapper document. When it does not parse, the file is
     * read again line by line with the first line counted as malformed.
     */
    private ReadSummary readWrapperDocument(Path dump, Consumer<JsonNode> sink) throws IOException {
        JsonNode document;
        try (BufferedReader reader = openReader(dump)) {
            peekFirstSignificantChar(reader);
            document = objectMapper.readTree(reader);
        } catch (JacksonException ex) {
            log.debug("{} is not a single JSON document ({}), reading it line by line", dump, ex.getOriginalMessage());
            try (BufferedReader reader = openReader(dump)) {
                peekFirstSignificantChar(reader);
                return readLines(dump, reader, sink, false);
            }
        }
        JsonNode wrapped = wrappedArray(document);
        if (wrapped == null) {
            throw new CatalogIngestException(dump, "JSON object has no 'data' or 'cards' array");
        }
        return emitWrapped(dump, wrapped, sink);
    }

    private static JsonNode wrappedArray(JsonNode node) {
        if (node == null || !node.isObject() || node.has("id")) {
            return null;
        }
        for (String field : WRAPPER_FIELDS) {
            JsonNode candidate = node.path(field);
            if (candidate.isArray()) {
                return candidate;
            }
        }
        return null;
    }

    private static ReadSummary emitWrapped(Path dump, JsonNode array, Consumer<JsonNode> sink) {
        long records = 0;
        long malformed = 0;
        for (JsonNode element : array) {
            if (element.isObject()) {
                sink.accept(element);
                records++;
            } else {
                malformed++;
            }
        }
        log.info("Read {} records from {} ({}, malformed={})", records, dump, DumpFormat.WRAPPED_ARRAY, malformed);
        return new ReadSummary(DumpFormat.WRAPPED_ARRAY, records, malformed);
    }
}
