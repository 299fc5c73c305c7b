package com.taxana.pricing;

import com.taxana.domain.PriceSource;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * USD price of a token from one tier of the waterfall, or NONE when no tier could price it.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PriceQuote {

    private static final PriceQuote NONE = new PriceQuote(null, PriceSource.NONE);

    private final BigDecimal priceUsd;
    private final PriceSource source;

    private PriceQuote(BigDecimal priceUsd, PriceSource source) {
        this.priceUsd = priceUsd;
        this.source = source;
    }

    public static PriceQuote of(BigDecimal priceUsd, PriceSource source) {
        if (priceUsd == null || source == null || source == PriceSource.NONE) {
            return NONE;
        }
        return new PriceQuote(priceUsd, source);
    }

    public static PriceQuote none() {
        return NONE;
    }

    public boolean isFromCache() {
        return source == PriceSource.CACHE;
    }

    public boolean isPriced() {
        return priceUsd != null;
    }

    public Optional<BigDecimal> getPriceUsd() {
        return Optional.ofNullable(priceUsd);
    }

    /** Price to value a leg with: the quote, or zero when unpriced. */
    public BigDecimal priceOrZero() {
        return priceUsd != null ? priceUsd : BigDecimal.ZERO;
    }
}
