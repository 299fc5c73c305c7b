package com.taxana.pricing.provider;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One external market-data source. A single attempt per call: no retries.
 * Implementations catch their own I/O and parse errors and report them as empty.
 */
public interface MarketPriceProvider {

    /** Short name for logs, e.g. "birdeye". */
    String name();

    Optional<BigDecimal> fetchPriceUsd(String token);
}
