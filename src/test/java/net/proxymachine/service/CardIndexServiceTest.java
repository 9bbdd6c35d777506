package net.proxymachine.service;

import net.proxymachine.config.CacheFactory;
import net.proxymachine.exception.ValidationException;
import net.proxymachine.model.CardQuery;
import net.proxymachine.model.IndexStatus;
import net.proxymachine.model.Print;
import net.proxymachine.repository.PrintQueryRepository;
import net.proxymachine.testutil.CardIndexFixture;
import net.proxymachine.testutil.CatalogRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardIndexServiceTest {

    @TempDir
    Path tempDir;

    private CardIndexFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void query_sharesCacheEntryForEquivalentFilters() {
        fixture = CardIndexFixture.build(tempDir, List.of(
            CatalogRecords.card("b1", "Lightning Bolt").lang("en"),
            CatalogRecords.card("b2", "Lightning Bolt").lang("de")));
        CardIndexService service = fixture.service();

        List<Print> first = service.query(CardQuery.builder().nameContains("Lightning  Bolt").langs(List.of("en", "de")).build());
        List<Print> second = service.query(CardQuery.builder().nameContains(" lightning bolt ").langs(List.of("DE", "EN")).build());

        assertThat(second).isSameAs(first);
        assertThat(service.cacheStats().hitCount()).isEqualTo(1);
        assertThat(service.cacheStats().missCount()).isEqualTo(1);
    }

    @Test
    void query_returnsUnmodifiableResults() {
        fixture = CardIndexFixture.build(tempDir, List.of(CatalogRecords.card("b1", "Lightning Bolt")));

        List<Print> rows = fixture.service().query(CardQuery.builder().build());

        assertThatThrownBy(rows::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rebuild_invalidatesCachedResults() {
        fixture = CardIndexFixture.build(tempDir, List.of(CatalogRecords.card("a1", "Alpha")));
        CardQuery all = CardQuery.builder().build();
        assertThat(fixture.service().query(all)).extracting(Print::getId).containsExactly("a1");

        fixture.rebuild(List.of(CatalogRecords.card("a1", "Alpha"), CatalogRecords.card("a2", "Alpha Two")));

        assertThat(fixture.service().query(all)).extracting(Print::getId).containsExactly("a1", "a2");
    }

    @Test
    void query_doesNotCacheRowsReadBeforeConcurrentRebuild() {
        fixture = CardIndexFixture.build(tempDir, List.of(CatalogRecords.card("a1", "Alpha")));
        AtomicReference<Runnable> afterFirstRead = new AtomicReference<>();
        PrintQueryRepository racing = new PrintQueryRepository(fixture.handle(), CatalogRecords.MAPPER) {
            @Override
            public List<Print> query(CardQuery query) {
                List<Print> rows = super.query(query);
                Runnable hook = afterFirstRead.getAndSet(null);
                if (hook != null) {
                    hook.run();
                }
                return rows;
            }
        };
        CardIndexService service = new CardIndexService(racing, fixture.builder(),
            new CacheFactory().createCache(100, Duration.ofMinutes(5)));
        Path dump = fixture.writeDump("next.ndjson", CatalogRecords.ndjson(List.of(
            CatalogRecords.card("a1", "Alpha"), CatalogRecords.card("a2", "Alpha Two"))));
        afterFirstRead.set(() -> service.rebuild(dump));
        CardQuery all = CardQuery.builder().build();

        assertThat(service.query(all)).extracting(Print::getId).containsExactly("a1");
        assertThat(service.query(all)).extracting(Print::getId).containsExactly("a1", "a2");
        assertThat(service.query(all)).extracting(Print::getId).containsExactly("a1", "a2");
        assertThat(service.cacheStats().hitCount()).isEqualTo(1);
    }

    @Test
    void query_rejectsMalformedFilters() {
        fixture = CardIndexFixture.build(tempDir, List.of(CatalogRecords.card("a1", "Alpha")));
        CardIndexService service = fixture.service();

        assertThatThrownBy(() -> service.query(CardQuery.builder().limit(-1).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.query(CardQuery.builder().limit(CardQuery.MAX_LIMIT + 1).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.query(CardQuery.builder().colorIdentityWithin(List.of("x")).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.query(CardQuery.builder().langs(List.of("en", " ")).build()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void status_reportsUnavailableIndexWithoutThrowing() {
        fixture = CardIndexFixture.empty(tempDir);

        IndexStatus status = fixture.service().status();

        assertThat(status.available()).isFalse();
        assertThat(status.unavailableReason()).contains("not found");
        assertThat(status.printCount()).isZero();
    }
}
