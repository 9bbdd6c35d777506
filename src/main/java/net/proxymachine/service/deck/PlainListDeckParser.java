package net.proxymachine.service.deck;

import net.proxymachine.model.CardRequest;

import java.util.Optional;

/**
 * One card name per line, optionally prefixed with a count.
 */
public class PlainListDeckParser extends LineDeckListParser {

    @Override
    public String format() {
        return "plain";
    }

    @Override
    protected boolean isHeader(String line) {
        return false;
    }

    @Override
    protected Optional<CardRequest> parseLine(String line) {
        return Optional.of(countedName(line));
    }
}
