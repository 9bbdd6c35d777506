package net.proxymachine.service.classify;

import net.proxymachine.model.Print;
import net.proxymachine.model.classify.ArtType;
import net.proxymachine.model.classify.CardTypeBucket;
import net.proxymachine.model.classify.LandCategory;
import net.proxymachine.model.classify.TokenBucket;
import net.proxymachine.util.SlugGenerator;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pure classification of prints into directory buckets. Every method is total: missing
 * or unexpected attributes fall into a default bucket, nothing throws.
 */
@Component
public class PrintClassifier {

    /** Sets whose non-basic lands are always filed as special (expeditions, masterpieces). */
    private static final Set<String> SPECIAL_LAND_SETS = Set.of("exp", "zne", "mps", "mp2", "mpr", "sld");
    private static final Set<String> SPECIAL_LAND_LAYOUTS = Set.of("modal_dfc", "transform");
    private static final Set<String> COLORED_MANA = Set.of("W", "U", "B", "R", "G");

    /** Known non-creature token kinds, matched against the token's name and type line. */
    private static final List<String> NONCREATURE_TOKEN_KINDS = List.of(
        "treasure", "food", "clue", "blood", "map", "powerstone", "gold", "incubator", "shard", "emblem", "role");

    private static final String RETRO_FRAME_CUTOFF = "2003-07-28";
    private static final Set<String> RETRO_FRAMES = Set.of("1993", "1997");

    // ── Lands ──

    public LandCategory classifyLand(Print print) {
        if (isBasicLand(print)) {
            return LandCategory.BASIC;
        }
        if (SPECIAL_LAND_SETS.contains(lower(print.getSetCode()))) {
            return LandCategory.SPECIAL;
        }
        if (SPECIAL_LAND_LAYOUTS.contains(lower(print.getLayout()))) {
            return LandCategory.SPECIAL;
        }
        int colors = coloredManaCount(print.getProducedMana());
        if (colors == 0) {
            colors = coloredManaCount(print.getColorIdentity());
        }
        if (colors == 2) {
            return LandCategory.DUAL;
        }
        if (colors == 3) {
            return LandCategory.TRI;
        }
        return LandCategory.SPECIAL;
    }

    private static int coloredManaCount(Collection<String> symbols) {
        if (symbols == null) {
            return 0;
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol != null && COLORED_MANA.contains(symbol.trim().toUpperCase(Locale.ROOT))) {
                distinct.add(symbol.trim().toUpperCase(Locale.ROOT));
            }
        }
        return distinct.size();
    }

    static boolean isBasicLand(Print print) {
        return print.isBasicLand() || lower(print.getTypeLine()).contains("basic land");
    }

    // ── Tokens ──

    public TokenBucket classifyToken(Print print) {
        String typeLine = lower(print.getTypeLine());
        String[] halves = typeLine.split("—", 2);
        String types = halves[0];
        String subtypes = halves.length > 1 ? halves[1].split("//", 2)[0].trim() : "";

        if (types.contains("creature")) {
            String subtype = SlugGenerator.slugifyOrDefault(subtypes, "unknown");
            return TokenBucket.creature(subtype, powerToughness(print));
        }

        String haystack = lower(print.getName()) + " " + typeLine;
        for (String kind : NONCREATURE_TOKEN_KINDS) {
            if (containsWord(haystack, kind)) {
                return TokenBucket.nonCreature(kind);
            }
        }
        return TokenBucket.nonCreature("misc");
    }

    private static String powerToughness(Print print) {
        String power = print.getPower();
        String toughness = print.getToughness();
        if (power == null || power.isBlank() || toughness == null || toughness.isBlank()) {
            return TokenBucket.UNKNOWN_POWER_TOUGHNESS;
        }
        return ptPart(power) + "-" + ptPart(toughness);
    }

    private static String ptPart(String value) {
        String cleaned = value.trim().replace("*", "x").replace("+", "plus").toLowerCase(Locale.ROOT);
        return SlugGenerator.slugifyOrDefault(cleaned, "x");
    }

    // ── Art ──

    public ArtType classifyArt(Print print) {
        List<String> effects = print.getFrameEffects() == null ? List.of() : print.getFrameEffects();
        if (print.isTextless()) {
            return ArtType.TEXTLESS;
        }
        if ("borderless".equals(lower(print.getBorderColor()))) {
            return ArtType.BORDERLESS;
        }
        if (effects.contains("showcase")) {
            return ArtType.SHOWCASE;
        }
        if (effects.contains("extendedart")) {
            return ArtType.EXTENDED;
        }
        String releasedAt = print.getReleasedAt();
        if (RETRO_FRAMES.contains(lower(print.getFrame())) && releasedAt != null && releasedAt.compareTo(RETRO_FRAME_CUTOFF) > 0) {
            return ArtType.RETRO;
        }
        if (print.isFullArt()) {
            return ArtType.FULLART;
        }
        return ArtType.STANDARD;
    }

    // ── Card types ──

    public CardTypeBucket classifyType(Print print) {
        String frontTypes = lower(print.getTypeLine()).split("//", 2)[0].split("—", 2)[0];
        for (CardTypeBucket bucket : CardTypeBucket.values()) {
            if (bucket.typeWord() != null && containsWord(frontTypes, bucket.typeWord())) {
                return bucket;
            }
        }
        return CardTypeBucket.OTHER;
    }

    /**
     * Relative directory for a print, e.g. {@code lands/basic/forest},
     * {@code tokens/creature/goblin/1-1} or {@code cards/instants}.
     */
    public String categoryPath(Print print) {
        if (print.isToken()) {
            return "tokens/" + classifyToken(print).relativePath();
        }
        if (isBasicLand(print)) {
            return "lands/basic/" + SlugGenerator.slugifyOrDefault(print.getName(), "unknown");
        }
        CardTypeBucket type = classifyType(print);
        if (type == CardTypeBucket.LAND) {
            return "lands/" + classifyLand(print).directory();
        }
        return "cards/" + type.directory();
    }

    private static boolean containsWord(String haystack, String word) {
        for (String part : haystack.split("[^a-z0-9]+")) {
            if (part.equals(word)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
