package net.proxymachine.service.deck;

import net.proxymachine.exception.ValidationException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fixed table of the supported deck list formats, keyed by format name.
 */
public final class DeckParserRegistry {

    private static final Map<String, DeckListParser> PARSERS = Map.of(
        "plain", new PlainListDeckParser(),
        "arena", new ArenaDeckParser(),
        "mtgo", new MtgoDeckParser());

    private DeckParserRegistry() {
    }

    public static Optional<DeckListParser> find(String format) {
        if (format == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PARSERS.get(format.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * @throws ValidationException when the format is unknown
     */
    public static DeckListParser require(String format) {
        return find(format).orElseThrow(() -> new ValidationException(
            "Unknown deck format '" + format + "', expected one of " + formats()));
    }

    public static Set<String> formats() {
        return new TreeSet<>(PARSERS.keySet());
    }

    /**
     * Picks a parser from the text itself: Arena when any line carries a set and collector
     * number, MTGO when a sideboard marker is present, plain otherwise.
     */
    public static DeckListParser detect(String text) {
        if (text != null) {
            for (String line : text.split("\\R")) {
                if (ArenaDeckParser.ARENA_LINE.matcher(line.strip()).matches()) {
                    return PARSERS.get("arena");
                }
            }
            if (text.toLowerCase(Locale.ROOT).contains("sideboard:")) {
                return PARSERS.get("mtgo");
            }
        }
        return PARSERS.get("plain");
    }
}
