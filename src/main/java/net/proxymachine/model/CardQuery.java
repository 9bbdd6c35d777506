package net.proxymachine.model;

import lombok.Builder;
import lombok.Value;
import net.proxymachine.exception.ValidationException;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filter for {@code CardIndexService#query}. Every field is optional; unset fields do not
 * constrain the result. Two filters that differ only in case, whitespace or language-list
 * order normalize to equal values and therefore share a query cache entry.
 */
@Value
@Builder(toBuilder = true)
public class CardQuery {

    private static final Set<String> COLOR_SYMBOLS = Set.of("w", "u", "b", "r", "g", "c");
    public static final int MAX_LIMIT = 10_000;

    /** Name equality, compared by slug so case and diacritics are ignored. */
    String nameEquals;
    /** Name substring. */
    String nameContains;
    /** Free text over name, oracle text and type line. */
    String text;
    String setCode;
    List<String> langs;
    String rarity;
    String layout;
    String typeLineContains;
    String artistContains;
    /** Color identity must be a subset of these symbols (W, U, B, R, G, C). */
    List<String> colorIdentityWithin;
    Boolean token;
    Boolean basicLand;
    boolean fullArtOnly;
    Integer limit;

    /**
     * Returns the canonical form of this filter.
     *
     * @throws ValidationException when the limit is negative or too large, a language is
     *         blank, or an unknown color symbol is given
     */
    public CardQuery normalized() {
        if (limit != null && (limit < 0 || limit > MAX_LIMIT)) {
            throw new ValidationException("limit must be between 0 and " + MAX_LIMIT + " but was " + limit);
        }
        return toBuilder()
            .nameEquals(normalizeText(nameEquals))
            .nameContains(normalizeText(nameContains))
            .text(normalizeText(text))
            .setCode(normalizeText(setCode))
            .langs(normalizeLangs(langs))
            .rarity(normalizeText(rarity))
            .layout(normalizeText(layout))
            .typeLineContains(normalizeText(typeLineContains))
            .artistContains(normalizeText(artistContains))
            .colorIdentityWithin(normalizeColors(colorIdentityWithin))
            .build();
    }

    private static String normalizeText(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static List<String> normalizeLangs(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            if (!StringUtils.hasText(value)) {
                throw new ValidationException("language filter contains a blank entry");
            }
            sorted.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return List.copyOf(sorted);
    }

    private static List<String> normalizeColors(List<String> values) {
        if (values == null) {
            return null;
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            String symbol = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
            if (!COLOR_SYMBOLS.contains(symbol)) {
                throw new ValidationException("unknown color symbol '" + value + "'");
            }
            sorted.add(symbol);
        }
        return sorted.stream().map(s -> s.toUpperCase(Locale.ROOT)).toList();
    }
}
