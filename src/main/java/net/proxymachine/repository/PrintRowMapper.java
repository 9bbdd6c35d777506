package net.proxymachine.repository;

import net.proxymachine.model.Print;
import org.springframework.jdbc.core.RowMapper;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps {@code prints} rows to {@link Print} and encodes the JSON array columns
 * (colors, color identity, produced mana, keywords, frame effects).
 */
public class PrintRowMapper implements RowMapper<Print> {

    private final ObjectMapper objectMapper;

    public PrintRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Print mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Print.builder()
            .id(rs.getString("id"))
            .oracleId(rs.getString("oracle_id"))
            .name(rs.getString("name"))
            .nameSlug(rs.getString("name_slug"))
            .setCode(rs.getString("set_code"))
            .setName(rs.getString("set_name"))
            .collectorNumber(rs.getString("collector_number"))
            .lang(rs.getString("lang"))
            .releasedAt(rs.getString("released_at"))
            .typeLine(rs.getString("type_line"))
            .layout(rs.getString("layout"))
            .rarity(rs.getString("rarity"))
            .oracleText(rs.getString("oracle_text"))
            .power(rs.getString("power"))
            .toughness(rs.getString("toughness"))
            .colors(decodeList(rs.getString("colors")))
            .colorIdentity(decodeList(rs.getString("color_identity")))
            .producedMana(decodeList(rs.getString("produced_mana")))
            .keywords(decodeList(rs.getString("keywords")))
            .artist(rs.getString("artist"))
            .imageUrl(rs.getString("image_url"))
            .frame(rs.getString("frame"))
            .frameEffects(decodeList(rs.getString("frame_effects")))
            .borderColor(rs.getString("border_color"))
            .illustrationId(rs.getString("illustration_id"))
            .token(rs.getInt("is_token") == 1)
            .basicLand(rs.getInt("is_basic_land") == 1)
            .fullArt(rs.getInt("full_art") == 1)
            .textless(rs.getInt("textless") == 1)
            .promo(rs.getInt("promo") == 1)
            .build();
    }

    /**
     * Encodes a list column; null becomes an empty array.
     */
    public String encodeList(List<String> values) {
        return objectMapper.writeValueAsString(values == null ? List.of() : values);
    }

    List<String> decodeList(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isArray()) {
                return List.of();
            }
            List<String> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (element.isString()) {
                    values.add(element.asString());
                }
            }
            return List.copyOf(values);
        } catch (JacksonException ex) {
            throw new SQLException("Malformed JSON list column: " + json, ex);
        }
    }
}
