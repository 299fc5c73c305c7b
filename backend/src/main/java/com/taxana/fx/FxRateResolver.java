package com.taxana.fx;

import java.math.BigDecimal;

/**
 * Supplies the USD → local currency rate for one calculation run. Never fails: falls back to a fixed rate.
 */
public interface FxRateResolver {

    BigDecimal usdToLocalRate();

    /** ISO code of the local currency, e.g. IDR. */
    String localCurrency();
}
