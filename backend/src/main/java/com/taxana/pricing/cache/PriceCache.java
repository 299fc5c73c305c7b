package com.taxana.pricing.cache;

import com.taxana.domain.PriceSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Store of earlier USD quotes keyed by (token, timestamp). Writes are insert-if-absent: on a key conflict the
 * existing entry stays. Shared across concurrent runs. Implementations report storage problems as a miss or
 * a dropped write; the resolver still treats any unchecked exception from either method that way.
 */
public interface PriceCache {

    /** Any stored price of the token whose timestamp lies within [at - window, at + window]. */
    Optional<BigDecimal> find(String token, Instant at, Duration window);

    /**
     * Inserts the quote unless an entry for (token, at) already exists.
     *
     * @return true if this call stored the entry
     */
    boolean putIfAbsent(String token, Instant at, BigDecimal priceUsd, PriceSource source);
}
