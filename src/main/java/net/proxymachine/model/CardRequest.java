package net.proxymachine.model;

/**
 * A card asked for by name, as produced by deck list parsers. Set code and collector
 * number are optional hints that win tie-breaks between equally good matches.
 */
public record CardRequest(String name, String setCode, String collectorNumber, int quantity) {

    public CardRequest {
        quantity = Math.max(quantity, 1);
    }

    public static CardRequest of(String name) {
        return new CardRequest(name, null, null, 1);
    }

    public static CardRequest of(String name, String setCode) {
        return new CardRequest(name, setCode, null, 1);
    }
}
