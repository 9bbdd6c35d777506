package net.proxymachine.model;

/**
 * What a caller prefers among prints that share a name: the requested set and collector
 * number, a language, and whether tokens or cards are wanted. Blank hints are dropped.
 */
public record NamePreference(String setCode, String collectorNumber, String lang, boolean token) {

    public NamePreference {
        setCode = trimToNull(setCode);
        collectorNumber = trimToNull(collectorNumber);
        lang = trimToNull(lang);
    }

    public static NamePreference forRequest(CardRequest request, String lang, boolean token) {
        return new NamePreference(request.setCode(), request.collectorNumber(), lang, token);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
