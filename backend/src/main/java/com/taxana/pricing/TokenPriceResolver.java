package com.taxana.pricing;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Resolves USD prices for Solana mints. Chain: cache (major tokens) → primary → secondary → NONE.
 * Never throws for provider problems; an unpriced token comes back as {@link PriceQuote#none()}.
 */
public interface TokenPriceResolver {

    PriceQuote resolvePrice(String token, Instant at);

    /**
     * Resolves each distinct token once. Every input token has an entry in the result.
     */
    Map<String, PriceQuote> resolvePrices(Collection<String> tokens, Instant at);
}
