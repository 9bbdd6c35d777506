package net.proxymachine.service.deck;

import net.proxymachine.model.CardRequest;

import java.util.Optional;

/**
 * MTGO text export: {@code 4 Lightning Bolt} lines, sideboard after a {@code SIDEBOARD:} line.
 */
public class MtgoDeckParser extends LineDeckListParser {

    @Override
    public String format() {
        return "mtgo";
    }

    @Override
    protected boolean isHeader(String line) {
        return line.equalsIgnoreCase("sideboard:") || line.equalsIgnoreCase("sideboard");
    }

    @Override
    protected Optional<CardRequest> parseLine(String line) {
        if (!COUNTED_LINE.matcher(line).matches()) {
            return Optional.empty();
        }
        return Optional.of(countedName(line));
    }
}
