package net.proxymachine.service.deck;

import net.proxymachine.model.CardRequest;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Arena export format: {@code 4 Lightning Bolt (M10) 146}, grouped under section headers.
 */
public class ArenaDeckParser extends LineDeckListParser {

    static final Pattern ARENA_LINE = Pattern.compile("^(\\d+)x?\\s+(.+?)\\s+\\((\\w+)\\)\\s+(\\S+)\\s*$");

    private static final Set<String> HEADERS = Set.of("deck", "sideboard", "commander", "companion", "maybeboard", "about");

    @Override
    public String format() {
        return "arena";
    }

    @Override
    protected boolean isHeader(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return HEADERS.contains(lower) || lower.startsWith("name ");
    }

    @Override
    protected Optional<CardRequest> parseLine(String line) {
        Matcher matcher = ARENA_LINE.matcher(line);
        if (matcher.matches()) {
            return Optional.of(new CardRequest(
                matcher.group(2),
                matcher.group(3).toLowerCase(Locale.ROOT),
                matcher.group(4),
                parseCount(matcher.group(1))));
        }
        if (COUNTED_LINE.matcher(line).matches()) {
            return Optional.of(countedName(line));
        }
        return Optional.empty();
    }
}
