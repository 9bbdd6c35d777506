package net.proxymachine.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import net.proxymachine.exception.DatabaseUnavailableException;
import net.proxymachine.model.CachedQueryKey;
import net.proxymachine.model.CardQuery;
import net.proxymachine.model.IndexBuildReport;
import net.proxymachine.model.IndexStatus;
import net.proxymachine.model.MatchTier;
import net.proxymachine.model.MeldGroup;
import net.proxymachine.model.NamePreference;
import net.proxymachine.model.Print;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.repository.PrintQueryRepository;
import net.proxymachine.service.catalog.CardIndexBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query surface of the card index: cached filtered queries, id and name lookups,
 * relationship edges, verification and rebuilds.
 * <p>
 * Failures to open or read the index surface as {@link DatabaseUnavailableException};
 * no method returns a partial result in that case.
 */
@Service
public class CardIndexService {

    private static final Logger log = LoggerFactory.getLogger(CardIndexService.class);

    private final PrintQueryRepository repository;
    private final CardIndexBuilder builder;
    private final Cache<CachedQueryKey, List<Print>> queryCache;

    public CardIndexService(PrintQueryRepository repository,
                            CardIndexBuilder builder,
                            Cache<CachedQueryKey, List<Print>> cardQueryCache) {
        this.repository = repository;
        this.builder = builder;
        this.queryCache = cardQueryCache;
    }

    /**
     * Prints matching the filter in deterministic order (release date, set, collector
     * number). Results are cached by the normalized filter and the index generation, so a
     * query that overlaps a rebuild cannot repopulate the cache with pre-rebuild rows.
     *
     * @throws net.proxymachine.exception.ValidationException when the filter is malformed
     */
    public List<Print> query(CardQuery query) {
        CardQuery normalized = query.normalized();
        // Read before querying; rows from an older index end up under a stale generation
        CachedQueryKey key = new CachedQueryKey(repository.indexGeneration(), normalized);
        List<Print> cached = queryCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        List<Print> rows = List.copyOf(repository.query(normalized));
        queryCache.put(key, rows);
        return rows;
    }

    public Optional<Print> findById(String printId) {
        return repository.findById(printId);
    }

    public Map<String, Print> findByIds(Collection<String> printIds) {
        return repository.findByIds(printIds);
    }

    public List<Print> findNameCandidates(String requestedName, MatchTier tier) {
        return repository.findNameCandidates(requestedName, tier);
    }

    public List<Print> findNameCandidates(String requestedName, MatchTier tier, NamePreference preference) {
        return repository.findNameCandidates(requestedName, tier, preference);
    }

    public List<Print> findByExactName(String name, String lang) {
        return repository.findByExactName(name, lang);
    }

    public List<RelationshipEdge> findRelationships(Collection<String> sourcePrintIds) {
        return repository.findRelationships(sourcePrintIds);
    }

    public List<MeldGroup> findMeldGroups() {
        return repository.findMeldGroups();
    }

    /**
     * Verifies the index and reports its size. Never throws for an unavailable index;
     * the reason is carried in the returned status.
     */
    public IndexStatus status() {
        try {
            return repository.status();
        } catch (DatabaseUnavailableException ex) {
            log.warn("Card index verification failed: {}", ex.getMessage());
            return IndexStatus.unavailable(ex.getMessage());
        }
    }

    /**
     * Rebuilds the index from a catalog dump and drops every cached query result.
     */
    public IndexBuildReport rebuild(Path dump) {
        IndexBuildReport report = builder.rebuild(dump);
        queryCache.invalidateAll();
        return report;
    }

    public CacheStats cacheStats() {
        return queryCache.stats();
    }
}
