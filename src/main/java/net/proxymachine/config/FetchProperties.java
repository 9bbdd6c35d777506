package net.proxymachine.config;

import jakarta.annotation.PostConstruct;
import net.proxymachine.model.fetch.FetchOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Strongly typed configuration for image fetching and bulk catalog downloads.
 */
@Component
@ConfigurationProperties(prefix = "fetch")
public class FetchProperties {

    /**
     * Maximum downloads in flight per batch.
     */
    private int concurrency = 8;

    /**
     * Upper bound for a single request attempt, body included.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * TCP connect timeout.
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Retries after the first attempt; a job is attempted at most {@code 1 + maxRetries} times.
     */
    private int maxRetries = 3;

    /**
     * First backoff delay; doubles on every retry.
     */
    private Duration baseDelay = Duration.ofMillis(500);

    /**
     * Ceiling for a single backoff delay.
     */
    private Duration maxDelay = Duration.ofSeconds(30);

    /**
     * Random jitter factor applied to backoff delays, between 0 and 1.
     */
    private double jitter = 0.5d;

    /**
     * Whether jobs whose destination already exists are skipped.
     */
    private boolean skipExisting = true;

    /**
     * Minimum usable space on the output file store before a batch may start.
     */
    private DataSize minFreeSpace = DataSize.ofMegabytes(100);

    /**
     * User-Agent header sent with every request.
     */
    private String userAgent = "ProxyMachine/0.1";

    /**
     * Base URL of the catalog API that publishes bulk-data descriptors.
     */
    private String bulkApiBaseUrl = "https://api.scryfall.com";

    /**
     * Bulk-data type to download (e.g. all_cards, default_cards).
     */
    private String bulkType = "all_cards";

    @PostConstruct
    void validate() {
        Assert.isTrue(concurrency > 0, "fetch.concurrency must be positive");
        Assert.isTrue(maxRetries >= 0, "fetch.max-retries must be non-negative");
        Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "fetch.request-timeout must be positive");
        Assert.isTrue(!connectTimeout.isNegative() && !connectTimeout.isZero(), "fetch.connect-timeout must be positive");
        Assert.isTrue(!baseDelay.isNegative(), "fetch.base-delay must be non-negative");
        Assert.isTrue(maxDelay.compareTo(baseDelay) >= 0, "fetch.max-delay must not be shorter than fetch.base-delay");
        Assert.isTrue(jitter >= 0d && jitter <= 1d, "fetch.jitter must be between 0 and 1");
        Assert.notNull(minFreeSpace, "fetch.min-free-space must be set");
        Assert.hasText(userAgent, "fetch.user-agent must not be blank");
        Assert.hasText(bulkApiBaseUrl, "fetch.bulk-api-base-url must not be blank");
        Assert.hasText(bulkType, "fetch.bulk-type must not be blank");
    }

    /**
     * Batch options built from the configured defaults.
     */
    public FetchOptions defaultOptions() {
        return new FetchOptions(skipExisting, concurrency);
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public double getJitter() {
        return jitter;
    }

    public void setJitter(double jitter) {
        this.jitter = jitter;
    }

    public boolean isSkipExisting() {
        return skipExisting;
    }

    public void setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
    }

    public DataSize getMinFreeSpace() {
        return minFreeSpace;
    }

    public void setMinFreeSpace(DataSize minFreeSpace) {
        this.minFreeSpace = minFreeSpace;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getBulkApiBaseUrl() {
        return bulkApiBaseUrl;
    }

    public void setBulkApiBaseUrl(String bulkApiBaseUrl) {
        this.bulkApiBaseUrl = bulkApiBaseUrl;
    }

    public String getBulkType() {
        return bulkType;
    }

    public void setBulkType(String bulkType) {
        this.bulkType = bulkType;
    }
}
