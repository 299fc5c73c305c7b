package com.taxana.pricing;

import com.taxana.domain.PriceSource;
import com.taxana.pricing.cache.PriceCache;
import com.taxana.pricing.config.PricingProperties;
import com.taxana.pricing.provider.MarketPriceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Price waterfall: cache (major tokens only) → primary provider → secondary provider → NONE.
 * Provider quotes for major tokens are written back to the cache, best effort.
 * Batch lookups run {@code batchSize} tokens concurrently and pause between batches.
 */
@RequiredArgsConstructor
@Slf4j
public class WaterfallPriceResolver implements TokenPriceResolver {

    private final PricingProperties pricingProperties;
    private final PriceCache priceCache;
    private final MarketPriceProvider primary;
    private final MarketPriceProvider secondary;
    private final Executor priceLookupExecutor;

    @Override
    public PriceQuote resolvePrice(String token, Instant at) {
        if (token == null || token.isBlank() || at == null) {
            return PriceQuote.none();
        }
        boolean major = pricingProperties.getMajorTokens().contains(token);
        if (major) {
            Optional<BigDecimal> cached = cached(token, at);
            if (cached.isPresent()) {
                log.debug("Price cache hit for {} near {}", token, at);
                return PriceQuote.of(cached.get(), PriceSource.CACHE);
            }
        }
        Optional<BigDecimal> price = fetch(primary, token);
        if (price.isPresent()) {
            return remember(token, at, price.get(), PriceSource.PRIMARY, major);
        }
        price = fetch(secondary, token);
        if (price.isPresent()) {
            return remember(token, at, price.get(), PriceSource.SECONDARY, major);
        }
        log.debug("No price for {} from any source", token);
        return PriceQuote.none();
    }

    @Override
    public Map<String, PriceQuote> resolvePrices(Collection<String> tokens, Instant at) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(tokens));
        unique.removeIf(Objects::isNull);
        Map<String, PriceQuote> result = new HashMap<>();
        int batchSize = Math.max(1, pricingProperties.getBatchSize());
        for (int i = 0; i < unique.size(); i += batchSize) {
            List<String> batch = unique.subList(i, Math.min(i + batchSize, unique.size()));
            List<CompletableFuture<PriceQuote>> futures = batch.stream()
                    .map(token -> CompletableFuture.supplyAsync(() -> resolvePrice(token, at), priceLookupExecutor))
                    .toList();
            for (int j = 0; j < batch.size(); j++) {
                result.put(batch.get(j), futures.get(j).join());
            }
            if (i + batchSize < unique.size()) {
                pause(pricingProperties.getBatchPause());
            }
        }
        log.debug("Resolved {} token prices ({} priced)", result.size(),
                result.values().stream().filter(PriceQuote::isPriced).count());
        return result;
    }

    private Optional<BigDecimal> cached(String token, Instant at) {
        try {
            Optional<BigDecimal> cached = priceCache.find(token, at, pricingProperties.getCacheWindow());
            return cached == null ? Optional.empty() : cached;
        } catch (RuntimeException e) {
            log.warn("Price cache read failed for {}: {}", token, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> fetch(MarketPriceProvider provider, String token) {
        try {
            Optional<BigDecimal> price = provider.fetchPriceUsd(token);
            if (price == null) {
                return Optional.empty();
            }
            return price;
        } catch (RuntimeException e) {
            log.warn("Price provider {} failed for {}", provider.name(), token, e);
            return Optional.empty();
        }
    }

    private PriceQuote remember(String token, Instant at, BigDecimal price, PriceSource source, boolean major) {
        if (major) {
            try {
                priceCache.putIfAbsent(token, at, price, source);
            } catch (RuntimeException e) {
                log.warn("Price cache write failed for {}: {}", token, e.getMessage());
            }
        }
        return PriceQuote.of(price, source);
    }

    private static void pause(Duration pause) {
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between price lookup batches", e);
        }
    }
}
