package com.taxana.pricing.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.taxana.domain.PriceSource;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-process price cache (taxana.pricing.cache-store=memory). One sorted timestamp→price map per token;
 * per-token maps are evicted by the Caffeine cache size bound.
 */
@RequiredArgsConstructor
public class CaffeinePriceCache implements PriceCache {

    private final Cache<String, NavigableMap<Instant, BigDecimal>> pricesByToken;

    @Override
    public Optional<BigDecimal> find(String token, Instant at, Duration window) {
        NavigableMap<Instant, BigDecimal> prices = pricesByToken.getIfPresent(token);
        if (prices == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, BigDecimal> hit = prices
                .subMap(at.minus(window), true, at.plus(window), true)
                .firstEntry();
        return hit == null ? Optional.empty() : Optional.of(hit.getValue());
    }

    @Override
    public boolean putIfAbsent(String token, Instant at, BigDecimal priceUsd, PriceSource source) {
        NavigableMap<Instant, BigDecimal> prices = pricesByToken.get(token, t -> new ConcurrentSkipListMap<>());
        return prices.putIfAbsent(at, priceUsd) == null;
    }
}
