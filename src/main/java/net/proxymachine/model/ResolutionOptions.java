package net.proxymachine.model;

import java.util.Locale;

/**
 * Knobs for relationship resolution.
 *
 * @param preferredLang language that wins tie-breaks between equally good matches
 * @param includeTokens whether token edges are followed
 */
public record ResolutionOptions(String preferredLang, boolean includeTokens) {

    public static final String DEFAULT_LANG = "en";

    public ResolutionOptions {
        preferredLang = preferredLang == null || preferredLang.isBlank()
            ? DEFAULT_LANG
            : preferredLang.trim().toLowerCase(Locale.ROOT);
    }

    public static ResolutionOptions defaults() {
        return new ResolutionOptions(DEFAULT_LANG, true);
    }
}
