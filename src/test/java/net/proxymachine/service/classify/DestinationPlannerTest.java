package net.proxymachine.service.classify;

import net.proxymachine.model.Print;
import net.proxymachine.model.fetch.FetchJob;
import net.proxymachine.service.fetch.FetchOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DestinationPlannerTest {

    @TempDir
    Path outputRoot;

    private final DestinationPlanner planner = new DestinationPlanner(new PrintClassifier());

    @Test
    void shouldPlanJobsUnderCategoryDirectories() {
        Print bolt = print("p1", "Lightning Bolt").typeLine("Instant").setCode("m10").collectorNumber("146").build();

        DestinationPlanner.Plan plan = planner.plan(List.of(bolt), outputRoot);

        assertThat(plan.unplannable()).isEmpty();
        FetchJob job = plan.jobs().get(0);
        assertThat(job.printId()).isEqualTo("p1");
        assertThat(job.sourceUri()).isEqualTo(bolt.getImageUrl());
        assertThat(job.destinationPath())
            .isEqualTo(outputRoot.toAbsolutePath().normalize().resolve("cards/instants/lightning-bolt-standard-en-m10-146.png"));
        assertThat(job.displayName()).isEqualTo("Lightning Bolt [m10 146]");
    }

    @Test
    void shouldSuffixCollidingDestinationsWithPrintId() {
        Print first = print("0123456789abcdef", "Plains").typeLine("Basic Land — Plains").basicLand(true)
            .setCode("sld").collectorNumber("100").build();
        Print second = first.toBuilder().id("fedcba9876543210").build();

        DestinationPlanner.Plan plan = planner.plan(List.of(first, second), outputRoot);

        assertThat(plan.jobs()).extracting(job -> job.destinationPath().getFileName().toString())
            .containsExactly("plains-standard-en-sld-100.png", "plains-standard-en-sld-100-fedcba98.png");
        assertThat(plan.jobs()).extracting(FetchJob::destinationPath).doesNotHaveDuplicates();
    }

    @Test
    void shouldKeepDestinationsUniqueWhenIdPrefixesAlsoCollide() {
        Print first = print("0123456789abcdef", "Plains").typeLine("Basic Land — Plains").basicLand(true)
            .setCode("sld").collectorNumber("100").build();
        Print second = first.toBuilder().id("fedcba9876543210").build();
        Print third = first.toBuilder().id("fedcba98ffffffff").build();
        Print fourth = first.toBuilder().id("fedcba9800000000").build();

        DestinationPlanner.Plan plan = planner.plan(List.of(first, second, third, fourth), outputRoot);

        assertThat(plan.jobs()).extracting(job -> job.destinationPath().getFileName().toString())
            .containsExactly("plains-standard-en-sld-100.png", "plains-standard-en-sld-100-fedcba98.png",
                "plains-standard-en-sld-100-fedcba98-2.png", "plains-standard-en-sld-100-fedcba98-3.png");
        assertThat(plan.unplannable()).isEmpty();
        FetchOrchestrator.validate(plan.jobs());
    }

    @Test
    void shouldReportPrintsWithoutImageAsUnplannable() {
        Print imageless = print("p2", "Mystery Card").imageUrl(null).build();
        Print blank = print("p3", "Blank Card").imageUrl(" ").build();
        Print good = print("p4", "Opt").build();

        DestinationPlanner.Plan plan = planner.plan(List.of(imageless, good, blank), outputRoot);

        assertThat(plan.jobs()).extracting(FetchJob::printId).containsExactly("p4");
        assertThat(plan.unplannable()).extracting(Print::getId).containsExactly("p2", "p3");
    }

    @Test
    void shouldNameTokensAndArtVariants() {
        Print token = print("t1", "Goblin").typeLine("Token Creature — Goblin").power("1").toughness("1").token(true)
            .setCode("tm19").collectorNumber("11").borderColor("borderless").build();

        FetchJob job = planner.plan(List.of(token), outputRoot).jobs().get(0);

        assertThat(outputRoot.toAbsolutePath().normalize().relativize(job.destinationPath()).toString().replace('\\', '/'))
            .isEqualTo("tokens/creature/goblin/1-1/goblin-borderless-en-tm19-11.png");
    }

    @ParameterizedTest
    @CsvSource({
        "https://img.example.test/a.png?1562,png",
        "https://img.example.test/a.JPEG,jpg",
        "https://img.example.test/a.webp,webp",
        "https://img.example.test/front/a,png",
        "https://img.example.test/a.gif,png",
        "https://img.example.test/dir.v2/a,png"
    })
    void extensionOf_defaultsToPng(String url, String expected) {
        assertThat(DestinationPlanner.extensionOf(url)).isEqualTo(expected);
    }

    private static Print.PrintBuilder print(String id, String name) {
        return Print.builder()
            .id(id)
            .name(name)
            .lang("en")
            .setCode("tst")
            .collectorNumber("1")
            .typeLine("Instant")
            .imageUrl("https://img.example.test/" + id + ".png");
    }
}
