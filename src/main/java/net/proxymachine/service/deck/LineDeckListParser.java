package net.proxymachine.service.deck;

import net.proxymachine.model.CardRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared line handling for the line-oriented formats: strips comments and blank lines
 * and hands every remaining line to {@link #parseLine}.
 */
abstract class LineDeckListParser implements DeckListParser {

    static final Pattern COUNTED_LINE = Pattern.compile("^(\\d+)x?\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);

    @Override
    public List<CardRequest> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<CardRequest> requests = new ArrayList<>();
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//") || isHeader(line)) {
                continue;
            }
            parseLine(line).ifPresent(requests::add);
        }
        return List.copyOf(requests);
    }

    /**
     * Section headers specific to the format (e.g. "Sideboard").
     */
    protected abstract boolean isHeader(String line);

    protected abstract Optional<CardRequest> parseLine(String line);

    /**
     * Parses {@code "4 Name"} or {@code "4x Name"}; a line without a count is one copy.
     */
    static CardRequest countedName(String line) {
        Matcher matcher = COUNTED_LINE.matcher(line);
        if (matcher.matches()) {
            return new CardRequest(matcher.group(2), null, null, parseCount(matcher.group(1)));
        }
        return CardRequest.of(line);
    }

    static int parseCount(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return 1;
        }
    }
}
