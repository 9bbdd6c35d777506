package net.proxymachine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One printed version of a card, normalized from a catalog record. Identified by the
 * catalog's print id; many prints share one {@code oracleId}.
 * <p>
 * List fields are never null; an absent value in the catalog becomes an empty list.
 */
@Value
@Builder(toBuilder = true)
public class Print {
    // Identity
    String id;
    String oracleId;
    String name;
    String nameSlug;
    String setCode;
    String setName;
    String collectorNumber;
    String lang;
    /** ISO-8601 date, lexicographically sortable. */
    String releasedAt;

    // Rules text and characteristics
    String typeLine;
    String layout;
    String rarity;
    String oracleText;
    String power;
    String toughness;
    List<String> colors;
    List<String> colorIdentity;
    List<String> producedMana;
    List<String> keywords;
    String artist;

    // Art
    String imageUrl;
    String frame;
    List<String> frameEffects;
    String borderColor;
    String illustrationId;

    // Derived flags
    boolean token;
    boolean basicLand;
    boolean fullArt;
    boolean textless;
    boolean promo;
}
