package net.proxymachine.mapper;

import net.proxymachine.model.CatalogEntry;
import net.proxymachine.model.Print;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.model.RelationshipKind;
import net.proxymachine.util.SlugGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps one catalog record (a print object from a bulk dump) to a {@link CatalogEntry}.
 * <p>
 * Derived fields:
 * - token flag from the token layouts, a "Token" type line, or a self-referencing token part
 * - basic-land flag from the supertypes ("Basic Land", "Basic Snow Land")
 * - image reference: best available size, falling back to the first face
 * - relationship edges from {@code all_parts}, self-references and unknown components dropped
 */
@Component
public class CatalogRecordMapper {

    private static final List<String> IMAGE_SIZE_PREFERENCE = List.of("png", "large", "normal", "small");
    private static final Set<String> TOKEN_LAYOUTS = Set.of("token", "double_faced_token", "emblem");
    private static final String FACE_SEPARATOR = " // ";

    /**
     * @return the normalized entry, or empty when the record has no id or name
     */
    public Optional<CatalogEntry> map(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }
        String id = text(record, "id");
        String name = text(record, "name");
        if (!StringUtils.hasText(id) || !StringUtils.hasText(name)) {
            return Optional.empty();
        }

        JsonNode faces = record.path("card_faces");
        JsonNode firstFace = faces.isArray() && !faces.isEmpty() ? faces.get(0) : null;

        String layout = lower(text(record, "layout"));
        String typeLine = firstNonBlank(text(record, "type_line"), joinFaces(faces, "type_line"));
        List<RelationshipEdge> edges = extractEdges(id, record.path("all_parts"));

        Print print = Print.builder()
            .id(id)
            .oracleId(firstNonBlank(text(record, "oracle_id"), firstFace == null ? null : text(firstFace, "oracle_id")))
            .name(name)
            .nameSlug(SlugGenerator.slugify(name))
            .setCode(lower(text(record, "set")))
            .setName(text(record, "set_name"))
            .collectorNumber(text(record, "collector_number"))
            .lang(lower(firstNonBlank(text(record, "lang"), "en")))
            .releasedAt(text(record, "released_at"))
            .typeLine(typeLine)
            .layout(layout)
            .rarity(lower(text(record, "rarity")))
            .oracleText(firstNonBlank(text(record, "oracle_text"), joinFaces(faces, "oracle_text", "\n\n")))
            .power(firstNonBlank(text(record, "power"), firstFace == null ? null : text(firstFace, "power")))
            .toughness(firstNonBlank(text(record, "toughness"), firstFace == null ? null : text(firstFace, "toughness")))
            .colors(stringList(record.has("colors") ? record.path("colors") : firstFacePath(firstFace, "colors")))
            .colorIdentity(stringList(record.path("color_identity")))
            .producedMana(stringList(record.path("produced_mana")))
            .keywords(stringList(record.path("keywords")))
            .artist(firstNonBlank(text(record, "artist"), firstFace == null ? null : text(firstFace, "artist")))
            .imageUrl(resolveImageUrl(record, faces))
            .frame(text(record, "frame"))
            .frameEffects(stringList(record.path("frame_effects")))
            .borderColor(lower(text(record, "border_color")))
            .illustrationId(firstNonBlank(text(record, "illustration_id"),
                firstFace == null ? null : text(firstFace, "illustration_id")))
            .token(isToken(layout, typeLine, id, record.path("all_parts")))
            .basicLand(isBasicLand(typeLine))
            .fullArt(record.path("full_art").asBoolean(false))
            .textless(record.path("textless").asBoolean(false))
            .promo(record.path("promo").asBoolean(false))
            .build();

        return Optional.of(new CatalogEntry(print, edges));
    }

    // ── Derived fields ──

    static boolean isToken(String layout, String typeLine, String id, JsonNode allParts) {
        if (layout != null && TOKEN_LAYOUTS.contains(layout)) {
            return true;
        }
        if (typeLine != null && typeLine.toLowerCase(Locale.ROOT).startsWith("token")) {
            return true;
        }
        if (allParts.isArray()) {
            for (JsonNode part : allParts) {
                if (id.equals(text(part, "id")) && "token".equalsIgnoreCase(text(part, "component"))) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isBasicLand(String typeLine) {
        if (typeLine == null) {
            return false;
        }
        String supertypes = typeLine.split("[—-]", 2)[0].toLowerCase(Locale.ROOT);
        return supertypes.contains("basic") && supertypes.contains("land");
    }

    static String resolveImageUrl(JsonNode record, JsonNode faces) {
        String url = bestImage(record.path("image_uris"));
        if (url != null) {
            return url;
        }
        if (faces.isArray()) {
            for (JsonNode face : faces) {
                String faceUrl = bestImage(face.path("image_uris"));
                if (faceUrl != null) {
                    return faceUrl;
                }
            }
        }
        return null;
    }

    private static String bestImage(JsonNode imageUris) {
        if (!imageUris.isObject()) {
            return null;
        }
        for (String size : IMAGE_SIZE_PREFERENCE) {
            String candidate = text(imageUris, size);
            if (StringUtils.hasText(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    static List<RelationshipEdge> extractEdges(String sourceId, JsonNode allParts) {
        if (!allParts.isArray()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<RelationshipEdge> edges = new ArrayList<>();
        for (JsonNode part : allParts) {
            String relatedId = text(part, "id");
            if (!StringUtils.hasText(relatedId) || relatedId.equals(sourceId)) {
                continue;
            }
            Optional<RelationshipKind> kind = RelationshipKind.fromComponent(text(part, "component"));
            if (kind.isEmpty()) {
                continue;
            }
            if (seen.add(relatedId + '|' + kind.get().component())) {
                edges.add(new RelationshipEdge(sourceId, relatedId, kind.get(), text(part, "name")));
            }
        }
        return edges;
    }

    // ── JSON helpers ──

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (value.isString() || value.isNumber()) {
            String text = value.asString().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private static JsonNode firstFacePath(JsonNode firstFace, String field) {
        return firstFace == null ? null : firstFace.path(field);
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (element.isString() && StringUtils.hasText(element.asString())) {
                values.add(element.asString());
            }
        }
        return List.copyOf(values);
    }

    private static String joinFaces(JsonNode faces, String field) {
        return joinFaces(faces, field, FACE_SEPARATOR);
    }

    private static String joinFaces(JsonNode faces, String field, String separator) {
        if (!faces.isArray() || faces.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode face : faces) {
            String value = text(face, field);
            if (value != null) {
                parts.add(value);
            }
        }
        return parts.isEmpty() ? null : String.join(separator, parts);
    }

    private static String firstNonBlank(String primary, String fallback) {
        return StringUtils.hasText(primary) ? primary : fallback;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
