package net.proxymachine.service.deck;

import net.proxymachine.model.CardRequest;

import java.util.List;

/**
 * Parses one deck list text format into card requests.
 */
public interface DeckListParser {

    /**
     * Registry key for this format, lower case.
     */
    String format();

    /**
     * Card requests in list order. Headers, comments and blank lines are ignored;
     * malformed lines are skipped.
     */
    List<CardRequest> parse(String text);
}
