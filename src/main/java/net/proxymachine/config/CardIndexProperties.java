package net.proxymachine.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Strongly typed configuration for the local card index.
 */
@Component
@ConfigurationProperties(prefix = "card-index")
public class CardIndexProperties {

    /**
     * SQLite file holding the live index. Rebuilds stage next to it and swap in atomically.
     */
    private Path path = Path.of("data", "cards.db");

    /**
     * Rows written per transaction during ingest.
     */
    private int batchSize = 1000;

    /**
     * Pooled read connections shared by concurrent queries.
     */
    private int readerPoolSize = 4;

    /**
     * Time-to-live for cached query results.
     */
    private Duration queryCacheTtl = Duration.ofMinutes(5);

    /**
     * Maximum number of cached query results.
     */
    private int queryCacheMaxSize = 1000;

    @PostConstruct
    void validate() {
        Assert.notNull(path, "card-index.path must be set");
        Assert.isTrue(batchSize > 0, "card-index.batch-size must be positive");
        Assert.isTrue(readerPoolSize > 0, "card-index.reader-pool-size must be positive");
        Assert.isTrue(!queryCacheTtl.isNegative() && !queryCacheTtl.isZero(),
                "card-index.query-cache-ttl must be positive");
        Assert.isTrue(queryCacheMaxSize > 0, "card-index.query-cache-max-size must be positive");
    }

    public Path getPath() {
        return path;
    }

    public void setPath(Path path) {
        this.path = path;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getReaderPoolSize() {
        return readerPoolSize;
    }

    public void setReaderPoolSize(int readerPoolSize) {
        this.readerPoolSize = readerPoolSize;
    }

    public Duration getQueryCacheTtl() {
        return queryCacheTtl;
    }

    public void setQueryCacheTtl(Duration queryCacheTtl) {
        this.queryCacheTtl = queryCacheTtl;
    }

    public int getQueryCacheMaxSize() {
        return queryCacheMaxSize;
    }

    public void setQueryCacheMaxSize(int queryCacheMaxSize) {
        this.queryCacheMaxSize = queryCacheMaxSize;
    }
}
