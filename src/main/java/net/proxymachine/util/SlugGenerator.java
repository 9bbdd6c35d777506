package net.proxymachine.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates the filesystem and lookup slugs used for card names, set codes and bucket
 * directories. Slugs are lowercase ASCII joined by single hyphens, so "Lim-Dûl's Vault"
 * and "lim dul's  vault" collapse to the same key.
 */
public final class SlugGenerator {
    private static final Pattern DIACRITICS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9\\s_-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_/]+");
    private static final Pattern MULTIPLE_DASHES = Pattern.compile("-{2,}");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private static final int MAX_SLUG_LENGTH = 120;

    private SlugGenerator() {}

    /**
     * Convert any string to a slug. Returns an empty string for null or blank input.
     */
    public static String slugify(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }

        String slug = Normalizer.normalize(input.trim(), Normalizer.Form.NFD);
        slug = DIACRITICS.matcher(slug).replaceAll("");
        slug = slug.toLowerCase(Locale.ROOT);

        // "Æther" and friends survive NFD untouched
        slug = slug.replace("æ", "ae").replace("œ", "oe");
        slug = slug.replace("&", "and");
        slug = slug.replace("'", "").replace("’", "");

        // "//" separates faces; keep it as a word break
        slug = SEPARATORS.matcher(slug).replaceAll("-");
        slug = NON_WORD.matcher(slug).replaceAll("");
        slug = MULTIPLE_DASHES.matcher(slug).replaceAll("-");
        slug = EDGE_DASHES.matcher(slug).replaceAll("");

        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = truncateAtWordBoundary(slug, MAX_SLUG_LENGTH);
        }
        return slug;
    }

    /**
     * Slugify with a fallback for inputs that reduce to nothing (e.g. "★" or null).
     */
    public static String slugifyOrDefault(String input, String fallback) {
        String slug = slugify(input);
        return slug.isEmpty() ? fallback : slug;
    }

    private static String truncateAtWordBoundary(String slug, int maxLength) {
        int lastDash = slug.lastIndexOf('-', maxLength);
        if (lastDash <= 0 || lastDash < maxLength / 2) {
            return slug.substring(0, maxLength);
        }
        return slug.substring(0, lastDash);
    }
}
