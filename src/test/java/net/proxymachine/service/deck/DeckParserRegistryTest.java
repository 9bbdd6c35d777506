package net.proxymachine.service.deck;

import net.proxymachine.exception.ValidationException;
import net.proxymachine.model.CardRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeckParserRegistryTest {

    private static final String ARENA = """
        Deck
        4 Lightning Bolt (M10) 146
        2 Fire // Ice (APC) 128
        Sideboard
        1 Pyroblast (ICE) 213
        """;

    private static final String MTGO = """
        4 Lightning Bolt
        20 Mountain

        SIDEBOARD:
        2 Pyroblast
        """;

    private static final String PLAIN = """
        # burn
        Lightning Bolt
        4x Lava Spike
        // comment
        Rift Bolt
        """;

    @Test
    void shouldParseArenaLinesWithSetAndCollectorNumber() {
        List<CardRequest> requests = DeckParserRegistry.require("arena").parse(ARENA);

        assertThat(requests).containsExactly(
            new CardRequest("Lightning Bolt", "m10", "146", 4),
            new CardRequest("Fire // Ice", "apc", "128", 2),
            new CardRequest("Pyroblast", "ice", "213", 1));
    }

    @Test
    void shouldParseMtgoListSkippingSideboardMarker() {
        List<CardRequest> requests = DeckParserRegistry.require("MTGO").parse(MTGO);

        assertThat(requests).extracting(CardRequest::name).containsExactly("Lightning Bolt", "Mountain", "Pyroblast");
        assertThat(requests).extracting(CardRequest::quantity).containsExactly(4, 20, 2);
    }

    @Test
    void shouldParsePlainListWithOptionalCounts() {
        List<CardRequest> requests = DeckParserRegistry.require("plain").parse(PLAIN);

        assertThat(requests).containsExactly(
            CardRequest.of("Lightning Bolt"),
            new CardRequest("Lava Spike", null, null, 4),
            CardRequest.of("Rift Bolt"));
    }

    @Test
    void shouldSkipMalformedLines() {
        assertThat(DeckParserRegistry.require("mtgo").parse("Lightning Bolt\n3 Shock")).containsExactly(
            new CardRequest("Shock", null, null, 3));
        assertThat(DeckParserRegistry.require("plain").parse("  \n")).isEmpty();
        assertThat(DeckParserRegistry.require("plain").parse(null)).isEmpty();
    }

    @Test
    void shouldDetectFormatFromText() {
        assertThat(DeckParserRegistry.detect(ARENA).format()).isEqualTo("arena");
        assertThat(DeckParserRegistry.detect(MTGO).format()).isEqualTo("mtgo");
        assertThat(DeckParserRegistry.detect(PLAIN).format()).isEqualTo("plain");
        assertThat(DeckParserRegistry.detect(null).format()).isEqualTo("plain");
    }

    @Test
    void shouldRejectUnknownFormat() {
        assertThat(DeckParserRegistry.find("moxfield")).isEmpty();
        assertThat(DeckParserRegistry.formats()).containsExactly("arena", "mtgo", "plain");
        assertThatThrownBy(() -> DeckParserRegistry.require("moxfield"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("arena, mtgo, plain");
    }
}
