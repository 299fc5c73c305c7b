package com.taxana.pricing.config;

import com.taxana.common.SolanaTokens;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Price waterfall configuration. Documented in application.yml under taxana.pricing.
 */
@ConfigurationProperties(prefix = "taxana.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Mints whose quotes are read from and written to the price cache.
     */
    private Set<String> majorTokens = new HashSet<>(SolanaTokens.DEFAULT_MAJOR_TOKENS);

    /**
     * Half-width of the cache window: a cached quote within [t - window, t + window] serves a lookup at t.
     */
    private Duration cacheWindow = Duration.ofHours(3);

    /**
     * Tokens resolved concurrently per batch.
     */
    private int batchSize = 5;

    /**
     * Pause between batches to stay under provider rate limits.
     */
    private Duration batchPause = Duration.ofMillis(200);

    /**
     * Upper bound for one provider call (single attempt, no retry).
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * Cache backend: mongo (token_prices collection, shared across instances) or memory (Caffeine, per process).
     */
    private CacheStore cacheStore = CacheStore.MONGO;

    /**
     * Max number of tokens held by the memory cache.
     */
    private long memoryCacheMaxTokens = 10_000;

    private Birdeye birdeye = new Birdeye();

    private Dexscreener dexscreener = new Dexscreener();

    public enum CacheStore {
        MONGO,
        MEMORY
    }

    @Getter
    @Setter
    public static class Birdeye {
        private String baseUrl = "https://public-api.birdeye.so";
        /** Provider is skipped while blank. */
        private String apiKey = "";
    }

    @Getter
    @Setter
    public static class Dexscreener {
        private String baseUrl = "https://api.dexscreener.com";
        /** Public API allows 300 requests per minute. */
        private int requestsPerMinute = 300;
    }
}
