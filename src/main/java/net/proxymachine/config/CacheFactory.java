package net.proxymachine.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import net.proxymachine.model.CachedQueryKey;
import net.proxymachine.model.Print;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 * Maintenance (expiry and eviction) runs on the calling thread, so no background
 * sweeper is involved and entries are checked on access.
 */
@Configuration
public class CacheFactory {

    /**
     * Create a bounded cache with write-based expiry.
     */
    public <K, V> Cache<K, V> createCache(int maxSize, Duration ttl) {
        return createCache(maxSize, ttl, Ticker.systemTicker());
    }

    /**
     * Create a bounded cache with write-based expiry measured by the given ticker.
     */
    public <K, V> Cache<K, V> createCache(int maxSize, Duration ttl, Ticker ticker) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .executor(Runnable::run)
            .ticker(ticker)
            .recordStats()
            .build();
    }

    @Bean
    public Cache<CachedQueryKey, List<Print>> cardQueryCache(CardIndexProperties properties) {
        return createCache(properties.getQueryCacheMaxSize(), properties.getQueryCacheTtl());
    }
}
